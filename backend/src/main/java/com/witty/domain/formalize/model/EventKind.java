package com.witty.domain.formalize.model;

public enum EventKind {
    ADAPTER_ATTEMPT_SUCCEEDED,
    ADAPTER_ATTEMPT_FAILED,
    FALLBACK_SUCCEEDED,
    DETERMINISTIC_PASS,
    CANDIDATE_REJECTED,
    CLAUSE_DROPPED,
    SIZE_LIMIT_EXCEEDED,
    CONTRADICTION_DETECTED,
    RETRIEVAL,
    RETRIEVAL_FAILED
}
