package com.witty.domain.formalize.model;

/**
 * Claim identifier categories. Each category keeps its own counter: E1, E2 … and R1, R2 …
 */
public enum ClaimCategory {
    // event-like predication
    EVENT("E"),
    // relational or quantifier-reduced claim (including presuppositions)
    RELATIONAL("R");

    private final String prefix;

    ClaimCategory(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
