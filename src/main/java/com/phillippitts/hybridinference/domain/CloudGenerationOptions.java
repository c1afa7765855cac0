package com.phillippitts.hybridinference.domain;

import java.util.Objects;

/** Options handed to a cloud provider. */
public record CloudGenerationOptions(String model, int maxTokens, float temperature, String systemPrompt) {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public CloudGenerationOptions {
        Objects.requireNonNull(model, "model");
        if (model.isBlank()) {
            throw new IllegalArgumentException("model must not be blank");
        }
    }

    /**
     * Derives cloud options from caller options.
     *
     * @param options caller options (may be null)
     * @param model requested cloud model (may be null, falls back to {@code defaultModel})
     * @param defaultModel model used when none is requested
     */
    public static CloudGenerationOptions from(GenerationOptions options, String model, String defaultModel) {
        GenerationOptions opts = options == null ? GenerationOptions.defaults() : options;
        String resolved = model != null && !model.isBlank() ? model
                : (defaultModel != null && !defaultModel.isBlank() ? defaultModel : DEFAULT_MODEL);
        return new CloudGenerationOptions(resolved, opts.maxTokens(), opts.temperature(), opts.systemPrompt());
    }
}
