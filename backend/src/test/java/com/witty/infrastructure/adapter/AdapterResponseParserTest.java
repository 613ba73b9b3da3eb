package com.witty.infrastructure.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.witty.domain.formalize.logic.LogicalNode;
import com.witty.domain.formalize.model.ClaimCategory;
import com.witty.domain.formalize.model.ModalTag;
import com.witty.infrastructure.adapter.AdapterResponseParser.CandidateSuggestions;
import com.witty.infrastructure.adapter.AdapterResponseParser.SegmentationHints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterResponseParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AdapterResponseParser parser = new AdapterResponseParser();

    private AdapterResponse json(String body) throws Exception {
        JsonNode node = objectMapper.readTree(body);
        return new AdapterResponse(body, node, 0, Map.of(),
                new AdapterProvenance("stub", "1", "t", "r", "json"));
    }

    @Nested
    @DisplayName("segment_v1")
    class Segmentation {

        @Test
        void parsesClaims() throws Exception {
            SegmentationHints hints = parser.parseSegmentation(json("""
                    {"confidence": 0.8, "claims": [
                      {"text": "Alice must go", "start": 0, "end": 13, "modal": "necessity",
                       "presuppositions": ["Alice exists"]},
                      {"text": "Bob stays", "start": 15, "end": 24, "category": "EVENT"}
                    ]}"""), 30);

            assertThat(hints.confidence()).isEqualTo(0.8);
            assertThat(hints.claims()).hasSize(2);
            assertThat(hints.claims().get(0).modal()).isEqualTo(ModalTag.NECESSITY);
            assertThat(hints.claims().get(0).category()).isNull();
            assertThat(hints.claims().get(0).presuppositions()).containsExactly("Alice exists");
            assertThat(hints.claims().get(1).category()).isEqualTo(ClaimCategory.EVENT);
        }

        @Test
        void rejectsTextOnlyResponse() {
            AdapterResponse response = new AdapterResponse("MOCK: hi", null, 0, Map.of(), null);

            assertThatThrownBy(() -> parser.parseSegmentation(response, 10))
                    .isInstanceOf(AdapterParseException.class);
        }

        @Test
        void rejectsOffsetsOutsideInput() {
            assertThatThrownBy(() -> parser.parseSegmentation(json("""
                    {"confidence": 0.9, "claims": [{"text": "x", "start": 5, "end": 50}]}"""), 10))
                    .isInstanceOf(AdapterParseException.class)
                    .hasMessageContaining("outside the input");
        }

        @Test
        void rejectsMissingConfidence() {
            assertThatThrownBy(() -> parser.parseSegmentation(json("""
                    {"claims": [{"text": "x", "start": 0, "end": 1}]}"""), 10))
                    .isInstanceOf(AdapterParseException.class);
        }

        @Test
        void rejectsConfidenceOutOfRange() {
            assertThatThrownBy(() -> parser.parseSegmentation(json("""
                    {"confidence": 1.5, "claims": [{"text": "x", "start": 0, "end": 1}]}"""), 10))
                    .isInstanceOf(AdapterParseException.class);
        }

        @Test
        void rejectsUnknownCategory() {
            assertThatThrownBy(() -> parser.parseSegmentation(json("""
                    {"confidence": 0.9, "claims": [{"text": "x", "start": 0, "end": 1, "category": "OTHER"}]}"""), 10))
                    .isInstanceOf(AdapterParseException.class);
        }
    }

    @Nested
    @DisplayName("symbolize_v1")
    class Candidates {

        @Test
        void parsesTreesAndKeepsMalformedCandidatesWithTheirError() throws Exception {
            CandidateSuggestions suggestions = parser.parseCandidates(json("""
                    {"confidence": 0.7, "candidates": [
                      {"ast": {"kind": "IMPLIES", "children": [{"kind": "ATOM", "symbol": "P1"},
                               {"kind": "MODAL", "operator": "◇", "children": [{"kind": "ATOM", "symbol": "P2"}]}]},
                       "confidence": 0.9, "basis": ["E1", "E2"]},
                      {"ast": {"kind": "NOT", "children": []}}
                    ]}"""));

            assertThat(suggestions.candidates()).hasSize(2);
            LogicalNode first = suggestions.candidates().get(0).ast();
            assertThat(first).isEqualTo(LogicalNode.implies(LogicalNode.atom("P1"),
                    LogicalNode.modal(ModalTag.POSSIBILITY, LogicalNode.atom("P2"))));
            assertThat(suggestions.candidates().get(0).basis()).containsExactly("E1", "E2");
            assertThat(suggestions.candidates().get(1).ast()).isNull();
            assertThat(suggestions.candidates().get(1).error()).isNotBlank();
            assertThat(suggestions.candidates().get(1).confidence()).isEqualTo(0.7);
        }

        @Test
        void rejectsMissingCandidatesArray() {
            assertThatThrownBy(() -> parser.parseCandidates(json("{\"confidence\": 0.7}")))
                    .isInstanceOf(AdapterParseException.class);
        }
    }
}
