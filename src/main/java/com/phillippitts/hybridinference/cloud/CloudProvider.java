package com.phillippitts.hybridinference.cloud;

import com.phillippitts.hybridinference.domain.CloudGenerationOptions;
import com.phillippitts.hybridinference.domain.CloudGenerationResult;
import reactor.core.publisher.Flux;

/**
 * Handle to one remote inference backend. Vendor wire formats stay behind this interface.
 *
 * <p>Implementations signal failure by throwing (typically
 * {@link com.phillippitts.hybridinference.exception.CloudProviderException}); the failover chain
 * counts any {@link RuntimeException} as a failed attempt.
 */
public interface CloudProvider {

    /** Stable unique id used for cost attribution and registry lookup. */
    String providerId();

    /** Human-readable name for logs and health details. */
    default String displayName() {
        return providerId();
    }

    CloudGenerationResult generate(String prompt, CloudGenerationOptions options);

    Flux<String> generateStream(String prompt, CloudGenerationOptions options);

    /** Lightweight health probe used to pick a backend for streaming. */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Pre-call cost estimate used for budget enforcement before any network call.
     *
     * @return estimated USD cost, 0 when the provider cannot price the call up front
     */
    default double estimateCostUsd(String prompt, CloudGenerationOptions options) {
        return 0.0;
    }
}
