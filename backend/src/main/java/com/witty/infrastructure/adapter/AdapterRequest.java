package com.witty.infrastructure.adapter;

/**
 * A schema-constrained request to a text-interpretation adapter.
 *
 * @param templateId      prompt template id (e.g. {@code segment_v1})
 * @param systemPrompt    instructions for the model
 * @param prompt          the user message
 * @param schema          JSON schema text the response must satisfy
 * @param normalizedInput the normalized input the prompt was built from; keys canned responses
 * @param attempt         1 for the initial call, 2 for the retry
 */
public record AdapterRequest(
        String templateId,
        String systemPrompt,
        String prompt,
        String schema,
        String normalizedInput,
        int attempt
) {}
