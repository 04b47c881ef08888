package com.aistudio.orchestrator.provider;

import java.util.Map;

/**
 * Text-generation backend used by the writing and planning agents.
 *
 * Calls block the worker thread until the provider answers.
 */
public interface TextGenerationProvider {

    /**
     * Single-turn completion.
     *
     * @param system    system prompt, may be null
     * @param prompt    user prompt
     * @param maxTokens upper bound on the reply length
     * @return the reply text
     * @throws ProviderException on transport or API failure
     */
    String complete(String system, String prompt, int maxTokens);

    /**
     * Completion whose reply is expected to be one JSON object.
     *
     * @throws ProviderException if the call fails or the reply holds no parseable object
     */
    Map<String, Object> completeJson(String system, String prompt, int maxTokens);
}
