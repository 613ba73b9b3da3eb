package com.witty.infrastructure.provenance;

import com.witty.domain.formalize.model.EnrichmentSource;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.OriginSpan;
import com.witty.domain.formalize.model.PrivacyMode;
import com.witty.domain.formalize.model.ProvenanceEvent;
import com.witty.domain.formalize.model.ProvenanceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ProvenanceRedactorTest {

    private ProvenanceRedactor redactor;
    private ProvenanceRecord record;

    @BeforeEach
    void setUp() {
        redactor = new ProvenanceRedactor();
        record = ProvenanceRecord.builder()
                .id("pr_0000000000000000-claim_reduction")
                .createdAt(Instant.EPOCH)
                .stageId("claim_reduction")
                .stageVersion("v1")
                .originSpans(List.of(new OriginSpan(0, 10)))
                .enrichmentSources(List.of(new EnrichmentSource("doc-1", "https://example.org/a", "Alice is a driver", new OriginSpan(2, 9))))
                .confidence(0.9)
                .ambiguityFlags(Set.of())
                .reductionRationale("see https://example.org/rules for details")
                .eventLog(List.of(
                        ProvenanceEvent.of(Instant.EPOCH, EventKind.DETERMINISTIC_PASS, "clause")
                                .withExcerpt("Alice owns", new OriginSpan(0, 10)),
                        ProvenanceEvent.of(Instant.EPOCH, EventKind.RETRIEVAL, "fetched www.example.org/x.")))
                .build();
    }

    @Test
    @DisplayName("Default mode returns the record untouched")
    void defaultModeUntouched() {
        assertThat(redactor.redact(record, PrivacyMode.DEFAULT)).isSameAs(record);
    }

    @Test
    @DisplayName("Strict mode replaces excerpts, source text and URLs with markers")
    void strictMode() {
        ProvenanceRecord redacted = redactor.redact(record, PrivacyMode.STRICT);

        assertThat(redacted.eventLog().get(0).excerpt()).isEqualTo("[REDACTED:span=0-10]");
        assertThat(redacted.eventLog().get(0).excerptSpan()).isEqualTo(new OriginSpan(0, 10));
        assertThat(redacted.eventLog().get(1).detail()).isEqualTo("fetched [REDACTED:url].");
        assertThat(redacted.enrichmentSources().get(0).url()).isEqualTo("[REDACTED:source=doc-1,span=2-9]");
        assertThat(redacted.enrichmentSources().get(0).excerpt()).isEqualTo("[REDACTED:source=doc-1,span=2-9]");
        assertThat(redacted.reductionRationale()).isEqualTo("see [REDACTED:url] for details");
        assertThat(redacted.originSpans()).isEqualTo(record.originSpans());
        assertThat(redacted.id()).isEqualTo(record.id());
    }

    @Test
    @DisplayName("Redacting twice equals redacting once")
    void idempotent() {
        ProvenanceRecord once = redactor.redact(record, PrivacyMode.STRICT);
        ProvenanceRecord twice = redactor.redact(once, PrivacyMode.STRICT);

        assertThat(twice).isEqualTo(once);
    }
}
