package com.witty.domain.formalize.model;

public enum ValidationIssueType {
    SYMBOL_COVERAGE,
    PROVENANCE_COVERAGE,
    TAUTOLOGY,
    TAUTOLOGICAL_CLAUSE,
    CONTRADICTION,
    SIZE_LIMIT
}
