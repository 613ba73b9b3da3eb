package com.witty.domain.formalize.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/**
 * External document consulted during enrichment.
 *
 * @param sourceId stable id of the source, never redacted
 * @param url      location of the source (redacted in strict privacy mode)
 * @param excerpt  raw summary text taken from the source (redacted in strict privacy mode)
 * @param span     span of the source document the excerpt summarises (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnrichmentSource(
        @NotBlank String sourceId,
        String url,
        String excerpt,
        OriginSpan span
) {}
