package com.witty.infrastructure.cnf;

import com.witty.domain.formalize.logic.Clause;
import com.witty.domain.formalize.logic.CnfResult;
import lombok.Getter;

import java.util.List;

/**
 * A clause simplified to the empty clause. Carries the clause set built from the remaining clauses.
 */
@Getter
public class ContradictionDetectedException extends RuntimeException {

    private final CnfResult partialResult;
    private final List<Clause> emptiedClauses;

    public ContradictionDetectedException(CnfResult partialResult, List<Clause> emptiedClauses) {
        super("Clause simplified to the empty clause: " + emptiedClauses.get(0).render());
        this.partialResult = partialResult;
        this.emptiedClauses = List.copyOf(emptiedClauses);
    }
}
