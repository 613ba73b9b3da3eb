package com.witty.domain.formalize.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Individual issue found while validating a formalization.
 *
 * @param type        the type of validation issue
 * @param severity    ERROR for coverage failures, WARNING for everything reported but tolerated
 * @param message     human-readable description of the issue
 * @param matchedText the token or clause that triggered this issue (nullable)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationIssue(
        ValidationIssueType type,
        Severity severity,
        String message,
        String matchedText
) {
    public enum Severity {
        ERROR,
        WARNING
    }
}
