package com.witty.infrastructure.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.witty.domain.formalize.logic.LogicalNode;
import com.witty.domain.formalize.logic.NodeKind;
import com.witty.domain.formalize.model.ClaimCategory;
import com.witty.domain.formalize.model.ClaimDraft;
import com.witty.domain.formalize.model.ModalTag;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured parsing of adapter responses for the {@code segment_v1} and {@code symbolize_v1} templates.
 * A response that does not match the schema raises {@link AdapterParseException}; a single malformed
 * logical-form candidate does not, it is returned with its error so the caller can reject it.
 */
@Component
public class AdapterResponseParser {

    public record SegmentationHints(double confidence, List<ClaimDraft> claims) {}

    /**
     * @param ast        parsed logical form, null when malformed
     * @param error      why the candidate was unusable (malformed tree, confidence outside [0, 1]), null when {@code ast} is set
     * @param confidence candidate confidence, the response confidence when absent
     * @param basis      claim identifiers the candidate was built from, empty when absent
     */
    public record CandidateSuggestion(LogicalNode ast, String error, double confidence, List<String> basis) {}

    public record CandidateSuggestions(double confidence, List<CandidateSuggestion> candidates) {}

    // ===== segment_v1 =====

    /**
     * @param textLength length of the normalized text the offsets refer to
     */
    public SegmentationHints parseSegmentation(AdapterResponse response, int textLength) {
        JsonNode root = requireObject(response);
        double confidence = requireConfidence(root);

        JsonNode claims = root.get("claims");
        if (claims == null || !claims.isArray() || claims.isEmpty()) {
            throw new AdapterParseException("'claims' must be a non-empty array");
        }

        List<ClaimDraft> drafts = new ArrayList<>();
        for (int i = 0; i < claims.size(); i++) {
            JsonNode claim = claims.get(i);
            String text = claim.path("text").asText("").strip();
            if (text.isEmpty()) {
                throw new AdapterParseException("claim " + i + " has no text");
            }
            if (!claim.path("start").canConvertToInt() || !claim.path("end").canConvertToInt()
                    || !claim.path("start").isIntegralNumber() || !claim.path("end").isIntegralNumber()) {
                throw new AdapterParseException("claim " + i + " has no integer offsets");
            }
            int start = claim.get("start").asInt();
            int end = claim.get("end").asInt();
            if (start < 0 || end > textLength || start >= end) {
                throw new AdapterParseException("claim " + i + " offsets [" + start + ", " + end + ") outside the input");
            }
            drafts.add(new ClaimDraft(text, start, end,
                    parseEnum(ClaimCategory.class, claim.get("category"), "category", i),
                    parseEnum(ModalTag.class, claim.get("modal"), "modal", i),
                    parsePresuppositions(claim.get("presuppositions"), i)));
        }
        return new SegmentationHints(confidence, drafts);
    }

    private List<String> parsePresuppositions(JsonNode node, int index) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new AdapterParseException("claim " + index + " presuppositions must be an array");
        }
        List<String> out = new ArrayList<>();
        for (JsonNode p : node) {
            String text = p.asText("").strip();
            if (!text.isEmpty()) {
                out.add(text);
            }
        }
        return out;
    }

    // ===== symbolize_v1 =====

    public CandidateSuggestions parseCandidates(AdapterResponse response) {
        JsonNode root = requireObject(response);
        double confidence = requireConfidence(root);

        JsonNode candidates = root.get("candidates");
        if (candidates == null || !candidates.isArray()) {
            throw new AdapterParseException("'candidates' must be an array");
        }

        List<CandidateSuggestion> out = new ArrayList<>();
        for (JsonNode candidate : candidates) {
            double candidateConfidence = candidate.path("confidence").isNumber()
                    ? candidate.get("confidence").asDouble()
                    : confidence;
            List<String> basis = new ArrayList<>();
            candidate.path("basis").forEach(b -> basis.add(b.asText()));
            if (!inUnitRange(candidateConfidence)) {
                out.add(new CandidateSuggestion(null, "confidence " + candidateConfidence + " outside [0, 1]",
                        confidence, basis));
                continue;
            }
            try {
                out.add(new CandidateSuggestion(parseNode(candidate.get("ast")), null, candidateConfidence, basis));
            } catch (IllegalArgumentException e) {
                out.add(new CandidateSuggestion(null, e.getMessage(), candidateConfidence, basis));
            }
        }
        return new CandidateSuggestions(confidence, out);
    }

    /**
     * Read a logical-form tree: {@code {"kind": ..., "symbol": ..., "operator": ..., "children": [...]}}.
     *
     * @throws IllegalArgumentException if the tree is malformed
     */
    public LogicalNode parseNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("node is not an object");
        }
        NodeKind kind;
        try {
            kind = NodeKind.valueOf(node.path("kind").asText(""));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown node kind '" + node.path("kind").asText("") + "'");
        }
        List<LogicalNode> children = new ArrayList<>();
        JsonNode childNodes = node.get("children");
        if (childNodes != null && childNodes.isArray()) {
            for (JsonNode child : childNodes) {
                children.add(parseNode(child));
            }
        }
        String symbol = kind == NodeKind.ATOM ? node.path("symbol").asText(null) : null;
        ModalTag operator = kind == NodeKind.MODAL ? parseOperator(node.path("operator").asText("")) : null;
        return new LogicalNode(kind, symbol, operator, children);
    }

    private static ModalTag parseOperator(String raw) {
        for (ModalTag tag : ModalTag.values()) {
            if (tag.name().equalsIgnoreCase(raw) || tag.operatorSymbol().equals(raw)) {
                return tag;
            }
        }
        throw new IllegalArgumentException("unknown modal operator '" + raw + "'");
    }

    // ===== Helpers =====

    private static JsonNode requireObject(AdapterResponse response) {
        JsonNode root = response.parsed()
                .orElseThrow(() -> new AdapterParseException("response carries no structured JSON"));
        if (!root.isObject()) {
            throw new AdapterParseException("response JSON is not an object");
        }
        return root;
    }

    private static double requireConfidence(JsonNode root) {
        JsonNode confidence = root.get("confidence");
        if (confidence == null || !confidence.isNumber()) {
            throw new AdapterParseException("'confidence' must be a number");
        }
        double value = confidence.asDouble();
        if (!inUnitRange(value)) {
            throw new AdapterParseException("'confidence' " + value + " outside [0, 1]");
        }
        return value;
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, JsonNode node, String field, int index) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return Enum.valueOf(type, node.asText().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new AdapterParseException("claim " + index + " has unknown " + field + " '" + node.asText() + "'");
        }
    }
}
