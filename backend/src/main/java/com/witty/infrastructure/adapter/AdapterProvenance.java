package com.witty.infrastructure.adapter;

/**
 * Where an adapter response came from.
 *
 * @param rawOutputSummary short, non-textual summary of the raw output (length, JSON or not)
 */
public record AdapterProvenance(
        String adapterId,
        String version,
        String templateId,
        String requestId,
        String rawOutputSummary
) {}
