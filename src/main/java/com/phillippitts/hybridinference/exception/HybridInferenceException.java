package com.phillippitts.hybridinference.exception;

/**
 * Base exception for all hybrid inference routing errors.
 * All domain exceptions should extend this class so callers can catch one type
 * or branch on the concrete subtype without inspecting messages.
 */
public class HybridInferenceException extends RuntimeException {

    public HybridInferenceException(String message) {
        super(message);
    }

    public HybridInferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public HybridInferenceException(Throwable cause) {
        super(cause);
    }
}
