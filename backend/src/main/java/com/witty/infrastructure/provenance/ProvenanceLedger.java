package com.witty.infrastructure.provenance;

import com.witty.domain.formalize.model.PrivacyMode;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.domain.formalize.model.StageId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Entry point for provenance: deterministic ids, pre-filled records and redaction.
 */
@Component
@RequiredArgsConstructor
public class ProvenanceLedger {

    private final ProvenanceIdGenerator idGenerator;
    private final ProvenanceRedactor redactor;

    public String newId(String normalizedInput, StageId stage, String salt) {
        return idGenerator.newId(normalizedInput, stage.id(), stage.version(), salt);
    }

    public String claimId(String normalizedInput, StageId stage, String salt, String claimIdentifier) {
        return idGenerator.claimId(normalizedInput, stage.id(), stage.version(), salt, claimIdentifier);
    }

    public String requestId(String normalizedInput, String salt, boolean reproducible) {
        return idGenerator.requestId(normalizedInput, salt, reproducible);
    }

    /**
     * A record builder with id, timestamp and stage fields set and every collection empty.
     */
    public ProvenanceRecord.ProvenanceRecordBuilder begin(String normalizedInput, StageId stage, String salt, Instant createdAt) {
        return ProvenanceRecord.builder()
                .id(newId(normalizedInput, stage, salt))
                .createdAt(createdAt)
                .stageId(stage.id())
                .stageVersion(stage.version())
                .originSpans(List.of())
                .enrichmentSources(List.of())
                .ambiguityFlags(Set.of())
                .eventLog(List.of());
    }

    public ProvenanceRecord redact(ProvenanceRecord record, PrivacyMode mode) {
        return redactor.redact(record, mode);
    }
}
