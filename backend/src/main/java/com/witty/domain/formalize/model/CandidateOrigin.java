package com.witty.domain.formalize.model;

public enum CandidateOrigin {
    ADAPTER,
    DEFAULT_CONJUNCTION
}
