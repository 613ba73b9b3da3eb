package com.witty.domain.formalize.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Audit trail of one stage execution (or of one claim produced by a stage).
 * The id is derived deterministically from the stage inputs and is never reassigned.
 * Ambiguity flags are kept sorted so the serialized form is stable.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProvenanceRecord(
        @NotBlank String id,
        @NotNull Instant createdAt,
        @NotBlank String stageId,
        @NotBlank String stageVersion,
        String adapterId,
        String templateId,
        String adapterRequestId,
        @NotNull List<@Valid OriginSpan> originSpans,
        @NotNull List<@Valid EnrichmentSource> enrichmentSources,
        @DecimalMin("0.0") @DecimalMax("1.0") double confidence,
        @NotNull Set<String> ambiguityFlags,
        String reductionRationale,
        @NotNull List<@Valid ProvenanceEvent> eventLog
) {

    public ProvenanceRecord {
        originSpans = originSpans == null ? List.of() : List.copyOf(originSpans);
        enrichmentSources = enrichmentSources == null ? List.of() : List.copyOf(enrichmentSources);
        SortedSet<String> flags = new TreeSet<>();
        if (ambiguityFlags != null) {
            flags.addAll(ambiguityFlags);
        }
        ambiguityFlags = Collections.unmodifiableSortedSet(flags);
        eventLog = eventLog == null ? List.of() : List.copyOf(eventLog);
    }

    public ProvenanceRecord withFlag(String flag) {
        Set<String> flags = new TreeSet<>(ambiguityFlags);
        flags.add(flag);
        return toBuilder().ambiguityFlags(flags).build();
    }

    public ProvenanceRecord withEvents(List<ProvenanceEvent> additional) {
        List<ProvenanceEvent> merged = new ArrayList<>(eventLog);
        merged.addAll(additional);
        return toBuilder().eventLog(merged).build();
    }
}
