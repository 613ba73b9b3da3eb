package com.witty.domain.formalize.model;

/**
 * Pipeline stages in execution order, with the version recorded in provenance.
 */
public enum StageId {
    INGEST("ingest", "v1"),
    PREPROCESSING("preprocessing", "v1"),
    CLAIM_REDUCTION("claim_reduction", "v1"),
    SYMBOLIZATION("symbolization", "v1"),
    CNF("cnf", "v1"),
    VALIDATION("validation", "v1");

    private final String id;
    private final String version;

    StageId(String id, String version) {
        this.id = id;
        this.version = version;
    }

    public String id() {
        return id;
    }

    public String version() {
        return version;
    }
}
