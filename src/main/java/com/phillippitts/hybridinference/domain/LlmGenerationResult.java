package com.phillippitts.hybridinference.domain;

/**
 * Text generation result, whichever backend produced it.
 *
 * @param confidence self-reported on-device confidence; {@code null} when not measured (cloud results)
 * @param handoffRequested whether the on-device capability asked for cloud escalation
 */
public record LlmGenerationResult(String text,
                                  int inputTokens,
                                  int tokensUsed,
                                  String modelUsed,
                                  double latencyMs,
                                  String framework,
                                  double tokensPerSecond,
                                  Float confidence,
                                  boolean handoffRequested,
                                  HandoffReason handoffReason) {

    public static final String CLOUD_FRAMEWORK = "cloud";

    public LlmGenerationResult {
        text = text == null ? "" : text;
        handoffReason = handoffReason == null ? HandoffReason.NONE : handoffReason;
    }

    /** On-device result without confidence instrumentation. */
    public static LlmGenerationResult local(String text, int tokensUsed, String modelUsed, double latencyMs) {
        return new LlmGenerationResult(text, 0, tokensUsed, modelUsed, latencyMs, "local",
                tokensPerSecond(tokensUsed, latencyMs), null, false, HandoffReason.NONE);
    }

    public static LlmGenerationResult fromCloud(CloudGenerationResult cloud) {
        return new LlmGenerationResult(cloud.text(), cloud.inputTokens(), cloud.outputTokens(), cloud.model(),
                cloud.latencyMs(), CLOUD_FRAMEWORK, tokensPerSecond(cloud.outputTokens(), cloud.latencyMs()),
                null, false, HandoffReason.NONE);
    }

    public LlmGenerationResult withConfidence(Float newConfidence, boolean newHandoffRequested,
                                              HandoffReason newReason) {
        return new LlmGenerationResult(text, inputTokens, tokensUsed, modelUsed, latencyMs, framework,
                tokensPerSecond, newConfidence, newHandoffRequested, newReason);
    }

    private static double tokensPerSecond(int tokens, double latencyMs) {
        return latencyMs > 0 ? tokens / (latencyMs / 1000.0) : 0.0;
    }
}
