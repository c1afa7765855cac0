package com.phillippitts.hybridinference.exception;

/**
 * Wraps failures of the on-device inference capability.
 * Propagated as-is in ALWAYS_LOCAL and HYBRID_MANUAL; treated as a handoff trigger in HYBRID_AUTO.
 */
public class LocalInferenceException extends HybridInferenceException {

    public LocalInferenceException(String message) {
        super(message);
    }

    public LocalInferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
