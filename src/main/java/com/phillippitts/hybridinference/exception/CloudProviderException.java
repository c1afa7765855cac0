package com.phillippitts.hybridinference.exception;

/**
 * Thrown when a cloud backend call fails (transport error, rejected request, bad payload).
 */
public class CloudProviderException extends HybridInferenceException {

    private final String providerId;

    public CloudProviderException(String providerId, String message) {
        super(message + " (provider: " + providerId + ")");
        this.providerId = providerId;
    }

    public CloudProviderException(String providerId, String message, Throwable cause) {
        super(message + " (provider: " + providerId + ")", cause);
        this.providerId = providerId;
    }

    public String getProviderId() {
        return providerId;
    }
}
