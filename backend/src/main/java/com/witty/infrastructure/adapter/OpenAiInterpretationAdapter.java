package com.witty.infrastructure.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import com.openai.core.RequestOptions;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.witty.infrastructure.provenance.ProvenanceIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * OpenAI chat-completions adapter with JSON response format.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "formalizer.adapter.openai.enabled", havingValue = "true")
public class OpenAiInterpretationAdapter implements TextInterpretationAdapter {

    public static final String ID = "openai";

    private final OpenAIClient openAIClient;
    private final ObjectMapper objectMapper;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.temperature:0.0}")
    private double temperature;

    @Value("${openai.max-tokens:1024}")
    private int maxTokens;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String version() {
        return model;
    }

    @Override
    public AdapterResponse request(AdapterRequest request, Duration timeout) {
        String content;
        long tokens = 0;
        String requestId;
        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(request.systemPrompt())
                    .addUserMessage(request.prompt())
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions()
                    .create(params, RequestOptions.builder().timeout(timeout).build());

            if (completion.usage().isPresent()) {
                var usage = completion.usage().get();
                tokens = usage.totalTokens();
                log.info("[OpenAiAdapter] Token usage [{}] - prompt: {}, completion: {}, total: {}",
                        request.templateId(), usage.promptTokens(), usage.completionTokens(), usage.totalTokens());
            }

            content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new AdapterParseException("OpenAI response has no content"));
            requestId = completion.id();
        } catch (AdapterException e) {
            throw e;
        } catch (Exception e) {
            log.error("[OpenAiAdapter] API call failed for template {}", request.templateId(), e);
            throw new AdapterException("OpenAI call failed: " + e.getClass().getSimpleName(), e);
        }

        JsonNode parsed = parseJson(content);
        if (requestId == null || requestId.isBlank()) {
            requestId = ProvenanceIdGenerator.sha256(ID + ":" + model + ":" + request.prompt()).substring(0, 12);
        }
        return new AdapterResponse(content, parsed, tokens, Map.of("model", model),
                new AdapterProvenance(ID, model, request.templateId(), requestId,
                        AdapterResponse.summarize(content, parsed != null)));
    }

    private JsonNode parseJson(String content) {
        try {
            JsonNode node = objectMapper.readTree(content.trim());
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.warn("[OpenAiAdapter] Response is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}
