package com.witty.domain.formalize.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Result of validating a complete formalization.
 *
 * @param symbolCoverageOk   every clause token resolves to the legend
 * @param provenanceCoverage claims with a non-empty origin span / total claims
 * @param tautology          the chosen form simplifies to TRUE
 * @param contradiction      the clause set is unsatisfiable
 * @param confidence         aggregated confidence
 * @param issues             all issues, ERROR and WARNING
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationReport(
        boolean symbolCoverageOk,
        @DecimalMin("0.0") @DecimalMax("1.0") double provenanceCoverage,
        boolean tautology,
        boolean contradiction,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence,
        @NotNull List<ValidationIssue> issues
) {

    public ValidationReport {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.severity() == ValidationIssue.Severity.ERROR);
    }

    @JsonIgnore
    public List<ValidationIssue> errors() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.ERROR).toList();
    }

    @JsonIgnore
    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == ValidationIssue.Severity.WARNING).toList();
    }
}
