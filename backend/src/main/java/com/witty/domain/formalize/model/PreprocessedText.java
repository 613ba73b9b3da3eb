package com.witty.domain.formalize.model;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Clause spans and marker annotations over the normalized text.
 */
public record PreprocessedText(
        @NotNull NormalizedText normalized,
        @NotEmpty List<AnnotatedSpan> clauses
) {

    public PreprocessedText {
        clauses = clauses == null ? List.of() : List.copyOf(clauses);
    }
}
