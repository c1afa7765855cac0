package com.phillippitts.hybridinference.local;

import com.phillippitts.hybridinference.domain.GenerationOptions;
import com.phillippitts.hybridinference.domain.LlmGenerationResult;
import com.phillippitts.hybridinference.exception.LocalInferenceException;
import reactor.core.publisher.Flux;

/**
 * Placeholder used when the application context has no on-device capability.
 * Every call fails, which in HYBRID_AUTO turns into a cloud fallback.
 */
public class UnavailableLocalInferenceService implements LocalInferenceService {

    @Override
    public LlmGenerationResult generate(String prompt, GenerationOptions options) {
        throw new LocalInferenceException("No on-device model is loaded");
    }

    @Override
    public Flux<String> generateStream(String prompt, GenerationOptions options) {
        return Flux.error(new LocalInferenceException("No on-device model is loaded"));
    }

    @Override
    public String name() {
        return "unavailable";
    }
}
