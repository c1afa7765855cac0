package com.phillippitts.hybridinference.domain;

/**
 * Caller-supplied generation options. The routing engine injects {@code confidenceThreshold}
 * before handing the options to the on-device capability.
 */
public record GenerationOptions(int maxTokens,
                                float temperature,
                                float topP,
                                String systemPrompt,
                                Float confidenceThreshold) {

    public static final int DEFAULT_MAX_TOKENS = 1024;
    public static final float DEFAULT_TEMPERATURE = 0.7f;

    public GenerationOptions {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE, 1.0f, null, null);
    }

    public GenerationOptions withConfidenceThreshold(float threshold) {
        return new GenerationOptions(maxTokens, temperature, topP, systemPrompt, threshold);
    }

    public GenerationOptions withSystemPrompt(String prompt) {
        return new GenerationOptions(maxTokens, temperature, topP, prompt, confidenceThreshold);
    }
}
