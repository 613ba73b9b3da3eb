package com.witty.infrastructure.cnf;

import com.witty.domain.formalize.logic.LogicalNode;
import lombok.Getter;

/**
 * Distribution produced more clauses than the configured ceiling.
 * Carries the implication-free negation normal form so callers can report it unexpanded.
 */
@Getter
public class SizeLimitExceededException extends RuntimeException {

    private final LogicalNode negationNormalForm;
    private final int maxClauses;

    public SizeLimitExceededException(LogicalNode negationNormalForm, int maxClauses) {
        super("CNF distribution exceeded " + maxClauses + " clauses");
        this.negationNormalForm = negationNormalForm;
        this.maxClauses = maxClauses;
    }
}
