package com.witty.domain.formalize.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Output of exactly one stage. Immutable once produced.
 *
 * @param payload    the stage-specific output
 * @param provenance audit record of this stage execution
 * @param confidence stage confidence in [0, 1]
 * @param warnings   ordered, non-fatal warnings raised by the stage
 */
public record StageResult<T>(
        @NotNull @Valid T payload,
        @NotNull @Valid ProvenanceRecord provenance,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence,
        @NotNull List<String> warnings
) {

    public StageResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static <T> StageResult<T> of(T payload, ProvenanceRecord provenance) {
        return new StageResult<>(payload, provenance, provenance.confidence(), List.of());
    }
}
