package com.witty.domain.formalize.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * One entry of a stage's event log.
 *
 * @param timestamp   when the event was recorded
 * @param kind        what happened
 * @param detail      human-readable outcome description; must not carry raw input text
 * @param durationMs  elapsed time of the attempt the event describes (0 when not timed)
 * @param excerpt     raw text excerpt attached to the event (nullable, redacted in strict mode)
 * @param excerptSpan span of the original text the excerpt was taken from (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProvenanceEvent(
        @NotNull Instant timestamp,
        @NotNull EventKind kind,
        String detail,
        long durationMs,
        String excerpt,
        OriginSpan excerptSpan
) {

    public static ProvenanceEvent of(Instant timestamp, EventKind kind, String detail) {
        return new ProvenanceEvent(timestamp, kind, detail, 0L, null, null);
    }

    public static ProvenanceEvent timed(Instant timestamp, EventKind kind, String detail, long durationMs) {
        return new ProvenanceEvent(timestamp, kind, detail, durationMs, null, null);
    }

    public ProvenanceEvent withExcerpt(String excerpt, OriginSpan excerptSpan) {
        return new ProvenanceEvent(timestamp, kind, detail, durationMs, excerpt, excerptSpan);
    }

    public ProvenanceEvent withDetail(String detail) {
        return new ProvenanceEvent(timestamp, kind, detail, durationMs, excerpt, excerptSpan);
    }
}
