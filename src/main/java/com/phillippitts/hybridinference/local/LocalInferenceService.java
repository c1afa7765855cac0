package com.phillippitts.hybridinference.local;

import com.phillippitts.hybridinference.domain.GenerationOptions;
import com.phillippitts.hybridinference.domain.LlmGenerationResult;
import reactor.core.publisher.Flux;

/**
 * On-device inference capability as seen by the routing core. Model loading, tokenization and the
 * native backend all live behind this interface.
 *
 * <p>Implementations read {@link GenerationOptions#confidenceThreshold()} and report back through
 * {@link LlmGenerationResult#confidence()} and {@link LlmGenerationResult#handoffRequested()}.
 * They should honor thread interruption: the routing engine interrupts a call that lost its
 * latency race.
 */
public interface LocalInferenceService {

    /**
     * @throws com.phillippitts.hybridinference.exception.LocalInferenceException on failure
     */
    LlmGenerationResult generate(String prompt, GenerationOptions options);

    Flux<String> generateStream(String prompt, GenerationOptions options);

    /** Name for logs and metrics. */
    default String name() {
        return "local";
    }
}
