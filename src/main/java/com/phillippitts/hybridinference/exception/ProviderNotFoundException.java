package com.phillippitts.hybridinference.exception;

/**
 * Thrown when a caller names a cloud provider id that was never registered.
 */
public class ProviderNotFoundException extends CloudProviderException {

    public ProviderNotFoundException(String providerId) {
        super(providerId, "Cloud provider not registered");
    }
}
