package com.witty.infrastructure.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.witty.infrastructure.provenance.ProvenanceIdGenerator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Deterministic, network-free adapter. Maps {@code (template_id, normalized input)} to a fixed canned
 * response; unknown pairs yield a text-only {@code MOCK:} response with no parsed JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MockInterpretationAdapter implements TextInterpretationAdapter {

    public static final String ID = "mock";
    static final String VERSION = "1";

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    /**
     * Canned-response files, comma separated; an entry in a later file replaces the same key in an earlier one.
     */
    @Value("${formalizer.adapter.mock.responses:classpath:mock/canned-responses.json}")
    private String[] responsesLocations;

    private volatile Map<String, JsonNode> cannedResponses = Map.of();

    @PostConstruct
    void loadCannedResponses() {
        Map<String, JsonNode> loaded = new HashMap<>();
        for (String location : responsesLocations) {
            Resource resource = resourceLoader.getResource(location.strip());
            if (!resource.exists()) {
                log.warn("[MockAdapter] No canned responses at {}", location);
                continue;
            }
            try (InputStream in = resource.getInputStream()) {
                for (JsonNode entry : objectMapper.readTree(in)) {
                    JsonNode response = entry.get("response");
                    if (response == null || response.isNull()) {
                        throw new IllegalStateException("Canned entry without a response in " + location);
                    }
                    loaded.put(key(entry.path("template_id").asText(), entry.path("input").asText()), response);
                }
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read canned responses from " + location, e);
            }
        }
        cannedResponses = Map.copyOf(loaded);
        log.info("[MockAdapter] Loaded {} canned responses", cannedResponses.size());
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public AdapterResponse request(AdapterRequest request, Duration timeout) {
        String requestId = ProvenanceIdGenerator.sha256(
                ID + ":" + VERSION + ":" + request.templateId() + ":" + request.normalizedInput()).substring(0, 12);

        JsonNode canned = cannedResponses.get(key(request.templateId(), request.normalizedInput()));
        if (canned == null) {
            String text = "MOCK: " + request.prompt();
            return new AdapterResponse(text, null, 0, Map.of("model", ID),
                    new AdapterProvenance(ID, VERSION, request.templateId(), requestId, AdapterResponse.summarize(text, false)));
        }

        String text = canned.toString();
        return new AdapterResponse(text, canned, 0, Map.of("model", ID),
                new AdapterProvenance(ID, VERSION, request.templateId(), requestId, AdapterResponse.summarize(text, true)));
    }

    private static String key(String templateId, String normalizedInput) {
        return templateId + ":" + ProvenanceIdGenerator.sha256(normalizedInput);
    }
}
