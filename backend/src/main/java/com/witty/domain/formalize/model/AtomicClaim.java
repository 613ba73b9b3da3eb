package com.witty.domain.formalize.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * A minimal proposition extracted from the input, assumed true for the duration of the analysis.
 *
 * @param identifier   E{n} or R{n}; unique within a request, assigned once by the claim reducer
 * @param text         the claim text
 * @param originSpans  spans of the original text the claim was taken from
 * @param category     identifier category
 * @param modalContext modal operator governing the claim (nullable)
 * @param symbol       P{n} bound by the symbolizer (null until symbolization)
 * @param introducedBy identifier of the claim whose quantifier introduced this presupposition (nullable)
 * @param provenance   claim-level provenance
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AtomicClaim(
        @NotBlank String identifier,
        @NotBlank String text,
        @NotEmpty List<@Valid OriginSpan> originSpans,
        @NotNull ClaimCategory category,
        ModalTag modalContext,
        String symbol,
        String introducedBy,
        @Valid ProvenanceRecord provenance
) {

    public AtomicClaim {
        originSpans = originSpans == null ? List.of() : List.copyOf(originSpans);
    }

    public AtomicClaim withSymbol(String symbol) {
        return new AtomicClaim(identifier, text, originSpans, category, modalContext, symbol, introducedBy, provenance);
    }

    public AtomicClaim withProvenance(ProvenanceRecord provenance) {
        return new AtomicClaim(identifier, text, originSpans, category, modalContext, symbol, introducedBy, provenance);
    }

    public boolean hasOriginSpan() {
        return originSpans.stream().anyMatch(span -> !span.isEmpty());
    }
}
