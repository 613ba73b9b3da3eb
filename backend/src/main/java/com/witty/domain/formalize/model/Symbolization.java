package com.witty.domain.formalize.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Output of the symbolizer: symbolized claims, the legend, validated candidates and the chosen form.
 */
public record Symbolization(
        @NotEmpty List<@Valid AtomicClaim> claims,
        @NotNull Legend legend,
        @NotEmpty List<@Valid LogicalFormCandidate> candidates,
        @NotNull @Valid LogicalFormCandidate chosen
) {

    public Symbolization {
        claims = List.copyOf(claims);
        candidates = List.copyOf(candidates);
    }
}
