package com.witty.infrastructure.pipeline.stage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.witty.domain.formalize.model.AmbiguityFlags;
import com.witty.domain.formalize.model.CandidateOrigin;
import com.witty.domain.formalize.model.EventKind;
import com.witty.domain.formalize.model.FormalizationResult;
import com.witty.domain.formalize.model.FormalizeOptions;
import com.witty.domain.formalize.model.LogicalFormCandidate;
import com.witty.domain.formalize.model.ProvenanceEvent;
import com.witty.domain.formalize.model.ProvenanceRecord;
import com.witty.infrastructure.pipeline.PipelineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AssistedSymbolizationStageTest {

    private static final String INPUT = "If Alice owns a red car, then she prefers driving.";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String IMPLIES = "{\"kind\":\"IMPLIES\",\"children\":[{\"kind\":\"ATOM\",\"symbol\":\"P1\"},{\"kind\":\"ATOM\",\"symbol\":\"P2\"}]}";
    private static final String AND = "{\"kind\":\"AND\",\"children\":[{\"kind\":\"ATOM\",\"symbol\":\"P1\"},{\"kind\":\"ATOM\",\"symbol\":\"P2\"}]}";
    private static final String OR = "{\"kind\":\"OR\",\"children\":[{\"kind\":\"ATOM\",\"symbol\":\"P1\"},{\"kind\":\"ATOM\",\"symbol\":\"P2\"}]}";
    private static final String UNKNOWN = "{\"kind\":\"AND\",\"children\":[{\"kind\":\"ATOM\",\"symbol\":\"P1\"},{\"kind\":\"ATOM\",\"symbol\":\"P7\"}]}";
    private static final String MALFORMED = "{\"kind\":\"IMPLIES\",\"children\":[{\"kind\":\"ATOM\",\"symbol\":\"P1\"}]}";

    @TempDir
    Path tempDir;

    private PipelineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private void suggest(double confidence, String... candidates) throws Exception {
        StringBuilder json = new StringBuilder("{\"confidence\":" + confidence + ",\"candidates\":[");
        for (int i = 0; i < candidates.length; i++) {
            json.append(i > 0 ? "," : "").append(candidates[i]);
        }
        String location = PipelineFixture.writeResponse(tempDir.resolve("symbolize.json"), "symbolize_v1", INPUT,
                MAPPER.readTree(json.append("]}").toString()));
        fixture.adapter(PipelineFixture.cannedMock(location));
    }

    private static String candidate(String ast, double confidence) {
        return "{\"ast\":" + ast + ",\"confidence\":" + confidence + "}";
    }

    private static ProvenanceRecord symbolization(FormalizationResult result) {
        return result.provenance().get(3);
    }

    @Test
    @DisplayName("Invalid candidates are rejected and recorded in the event log")
    void invalidCandidatesAreRejectedAndRecorded() throws Exception {
        suggest(0.8, candidate(UNKNOWN, 0.95), candidate(MALFORMED, 0.9), candidate(IMPLIES, 0.7));

        FormalizationResult result = fixture.orchestrator().run(INPUT, FormalizeOptions.defaults());

        assertThat(result.logicalFormCandidates()).extracting(LogicalFormCandidate::notation).containsExactly("P1 → P2");
        assertThat(result.logicalFormCandidates().get(0).origin()).isEqualTo(CandidateOrigin.ADAPTER);
        assertThat(result.logicalFormCandidates().get(0).basis()).containsExactly("E1", "E2");
        assertThat(symbolization(result).eventLog())
                .filteredOn(event -> event.kind() == EventKind.CANDIDATE_REJECTED)
                .extracting(ProvenanceEvent::detail)
                .satisfiesExactly(
                        detail -> assertThat(detail).startsWith("candidate 1:").contains("P7"),
                        detail -> assertThat(detail).startsWith("candidate 2: malformed"));
        assertThat(result.warnings()).contains("candidate_rejected:symbolization");
        assertThat(result.confidence()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Keeps top-k candidates and chooses the most confident, first on ties")
    void keepsTopKAndChoosesHighestConfidence() throws Exception {
        suggest(0.9, candidate(AND, 0.6), candidate(OR, 0.8), candidate(IMPLIES, 0.8), candidate(IMPLIES, 0.99));
        FormalizeOptions options = FormalizeOptions.defaults().toBuilder().topKSymbolizations(3).build();

        FormalizationResult result = fixture.orchestrator().run(INPUT, options);

        assertThat(result.logicalFormCandidates()).extracting(LogicalFormCandidate::notation)
                .containsExactly("P1 ∧ P2", "P1 ∨ P2", "P1 → P2");
        // tie between the second and third candidate: first one wins
        assertThat(result.chosenLogicalForm().render()).isEqualTo("P1 ∨ P2");
        assertThat(result.cnf()).isEqualTo("P1 ∨ P2");
    }

    @Test
    @DisplayName("No valid candidate falls back to the default conjunction")
    void noValidCandidateFallsBackToDefaultConjunction() throws Exception {
        suggest(0.7, candidate(UNKNOWN, 0.9));

        FormalizationResult result = fixture.orchestrator().run(INPUT, FormalizeOptions.defaults());

        assertThat(result.chosenLogicalForm().render()).isEqualTo("P1 ∧ P2");
        assertThat(result.logicalFormCandidates()).singleElement()
                .extracting(LogicalFormCandidate::origin).isEqualTo(CandidateOrigin.DEFAULT_CONJUNCTION);
        assertThat(symbolization(result).ambiguityFlags())
                .contains(AmbiguityFlags.DEFAULT_CONJUNCTION, AmbiguityFlags.CANDIDATE_REJECTED)
                .doesNotContain(AmbiguityFlags.HUMAN_REVIEW);
        assertThat(symbolization(result).adapterId()).isEqualTo("mock");
        assertThat(result.confidence()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Low-confidence responses use the deterministic fallback")
    void lowConfidenceResponsesUseTheFallback() throws Exception {
        suggest(0.3, candidate(IMPLIES, 0.9));

        FormalizationResult result = fixture.orchestrator().run(INPUT, FormalizeOptions.defaults());

        assertThat(result.chosenLogicalForm().render()).isEqualTo("P1 ∧ P2");
        assertThat(symbolization(result).eventLog()).extracting(ProvenanceEvent::kind).containsSubsequence(
                EventKind.ADAPTER_ATTEMPT_FAILED, EventKind.ADAPTER_ATTEMPT_FAILED, EventKind.FALLBACK_SUCCEEDED);
        assertThat(result.warnings()).contains("human_review:symbolization", "default_conjunction:symbolization");
        assertThat(result.confidence()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Legend context lists every symbol with its claim")
    void legendContextListsEverySymbol() {
        FormalizationResult result = fixture.orchestrator().run(INPUT, FormalizeOptions.defaults());

        assertThat(AssistedSymbolizationStage.legendContext(result.atomicClaims()))
                .isEqualTo("P1 (E1): Alice owns a red car\nP2 (E2): she prefers driving");
    }

    @Test
    @DisplayName("A candidate confidence above 1 rejects that candidate only")
    void candidateConfidenceAboveOneIsRejected() throws Exception {
        suggest(0.9, candidate(IMPLIES, 1.5), candidate(AND, 0.8));

        FormalizationResult result = fixture.orchestrator().run(INPUT, FormalizeOptions.defaults());

        assertThat(result.logicalFormCandidates()).extracting(LogicalFormCandidate::notation).containsExactly("P1 ∧ P2");
        assertThat(symbolization(result).eventLog())
                .filteredOn(event -> event.kind() == EventKind.CANDIDATE_REJECTED)
                .extracting(ProvenanceEvent::detail)
                .singleElement().asString().contains("outside [0, 1]");
        assertThat(result.warnings()).contains("candidate_rejected:symbolization");
        assertThat(result.confidence()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("A negative candidate confidence leaves the default conjunction")
    void negativeCandidateConfidenceIsRejected() throws Exception {
        suggest(0.9, candidate(IMPLIES, -0.3));

        FormalizationResult result = fixture.orchestrator().run(INPUT, FormalizeOptions.defaults());

        assertThat(result.chosenLogicalForm().render()).isEqualTo("P1 ∧ P2");
        assertThat(symbolization(result).ambiguityFlags())
                .contains(AmbiguityFlags.DEFAULT_CONJUNCTION, AmbiguityFlags.CANDIDATE_REJECTED);
        assertThat(symbolization(result).confidence()).isBetween(0.0, 1.0);
    }
}
