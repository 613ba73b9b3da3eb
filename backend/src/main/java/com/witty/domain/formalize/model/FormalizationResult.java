package com.witty.domain.formalize.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.witty.domain.formalize.logic.LogicalNode;
import lombok.Builder;

import java.util.List;

/**
 * Final, fully assembled formalization of one input.
 * Only ever produced whole; a failed or cancelled request produces none.
 */
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"request_id", "original_text", "canonical_text", "atomic_claims", "legend",
        "logical_form_candidates", "chosen_logical_form", "cnf", "cnf_clauses", "modal_metadata",
        "warnings", "confidence", "provenance", "validation_report", "event_log"})
public record FormalizationResult(
        String requestId,
        String originalText,
        String canonicalText,
        List<AtomicClaim> atomicClaims,
        Legend legend,
        List<LogicalFormCandidate> logicalFormCandidates,
        LogicalNode chosenLogicalForm,
        String cnf,
        List<List<String>> cnfClauses,
        ModalMetadata modalMetadata,
        List<String> warnings,
        double confidence,
        List<ProvenanceRecord> provenance,
        ValidationReport validationReport,
        List<ProvenanceEvent> eventLog
) {

    public FormalizationResult {
        atomicClaims = atomicClaims == null ? List.of() : List.copyOf(atomicClaims);
        logicalFormCandidates = logicalFormCandidates == null ? List.of() : List.copyOf(logicalFormCandidates);
        cnfClauses = cnfClauses == null ? List.of() : cnfClauses.stream().map(List::copyOf).toList();
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        provenance = provenance == null ? List.of() : List.copyOf(provenance);
        eventLog = eventLog == null ? List.of() : List.copyOf(eventLog);
    }
}
