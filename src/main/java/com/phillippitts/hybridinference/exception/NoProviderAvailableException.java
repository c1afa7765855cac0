package com.phillippitts.hybridinference.exception;

import java.util.Optional;

/**
 * Thrown when every cloud backend was either skipped (open circuit, failed health probe)
 * or failed. Carries the last observed provider error as its cause when there was one.
 */
public class NoProviderAvailableException extends HybridInferenceException {

    public NoProviderAvailableException(String message) {
        super(message);
    }

    public NoProviderAvailableException(String message, Throwable lastError) {
        super(lastError == null ? message : message + ": " + lastError.getMessage(), lastError);
    }

    /**
     * @return the last error raised by a provider before the chain gave up, if any
     */
    public Optional<Throwable> getLastError() {
        return Optional.ofNullable(getCause());
    }
}
