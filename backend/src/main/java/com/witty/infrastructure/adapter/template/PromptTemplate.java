package com.witty.infrastructure.adapter.template;

import com.witty.infrastructure.adapter.AdapterRequest;

/**
 * Versioned prompt template. {@code {input}} and {@code {context}} in the user message are substituted.
 */
public record PromptTemplate(
        String id,
        String version,
        String systemPrompt,
        String userMessage,
        String retryHint,
        String responseSchema
) {

    public String renderUserMessage(String input, String context) {
        return userMessage
                .replace("{context}", context != null ? context : "")
                .replace("{input}", input);
    }

    /**
     * Build the request for one attempt. The retry carries the retry hint after the user message.
     */
    public AdapterRequest toRequest(String normalizedInput, String context, int attempt) {
        String prompt = renderUserMessage(normalizedInput, context);
        if (attempt > 1) {
            prompt = prompt + "\n\n" + retryHint;
        }
        return new AdapterRequest(id, systemPrompt + "\n\nRespond with JSON matching this schema:\n" + responseSchema,
                prompt, responseSchema, normalizedInput, attempt);
    }
}
