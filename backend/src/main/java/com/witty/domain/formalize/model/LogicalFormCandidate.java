package com.witty.domain.formalize.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.witty.domain.formalize.logic.LogicalNode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * A validated logical-form candidate.
 *
 * @param ast        the logical form
 * @param notation   canonical infix rendering of {@code ast}
 * @param confidence candidate confidence
 * @param basis      claim identifiers the candidate was built from
 * @param origin     where the candidate came from
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LogicalFormCandidate(
        @NotNull LogicalNode ast,
        @NotNull String notation,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence,
        @NotNull List<String> basis,
        @NotNull CandidateOrigin origin
) {

    public LogicalFormCandidate {
        basis = basis == null ? List.of() : List.copyOf(basis);
    }

    public static LogicalFormCandidate of(LogicalNode ast, double confidence, List<String> basis, CandidateOrigin origin) {
        return new LogicalFormCandidate(ast, ast.render(), confidence, basis, origin);
    }
}
