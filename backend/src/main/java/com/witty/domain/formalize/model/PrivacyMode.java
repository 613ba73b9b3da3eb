package com.witty.domain.formalize.model;

public enum PrivacyMode {
    DEFAULT,
    STRICT
}
