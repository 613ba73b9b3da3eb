package com.witty.domain.formalize.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Ordered atomic claims emitted by the claim reducer.
 */
public record ClaimSet(
        @NotBlank String canonicalText,
        @NotEmpty List<@Valid AtomicClaim> claims
) {

    public ClaimSet {
        claims = claims == null ? List.of() : List.copyOf(claims);
    }
}
