package com.witty.infrastructure.adapter;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

/**
 * @param text          raw response text
 * @param parsedJson    structured response, null when the output was not JSON
 * @param tokens        tokens consumed (0 when unknown)
 * @param modelMetadata model name and similar, adapter specific
 */
public record AdapterResponse(
        String text,
        JsonNode parsedJson,
        long tokens,
        Map<String, String> modelMetadata,
        AdapterProvenance adapterProvenance
) {

    public AdapterResponse {
        modelMetadata = modelMetadata == null ? Map.of() : Map.copyOf(modelMetadata);
    }

    public Optional<JsonNode> parsed() {
        return Optional.ofNullable(parsedJson);
    }

    static String summarize(String text, boolean json) {
        return (json ? "json" : "text") + ", " + (text == null ? 0 : text.length()) + " chars";
    }
}
