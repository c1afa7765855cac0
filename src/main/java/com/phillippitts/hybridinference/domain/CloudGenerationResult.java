package com.phillippitts.hybridinference.domain;

import java.util.Objects;

/**
 * Result of a cloud provider call.
 *
 * @param estimatedCostUsd provider-side cost estimate, or {@code null} when the provider cannot price the call
 */
public record CloudGenerationResult(String text,
                                    int inputTokens,
                                    int outputTokens,
                                    double latencyMs,
                                    String providerId,
                                    String model,
                                    Double estimatedCostUsd) {

    public CloudGenerationResult {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(model, "model");
        text = text == null ? "" : text;
    }
}
