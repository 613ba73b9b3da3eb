package com.witty.domain.formalize.logic;

public enum NodeKind {
    ATOM,
    NOT,
    AND,
    OR,
    IMPLIES,
    IFF,
    MODAL
}
