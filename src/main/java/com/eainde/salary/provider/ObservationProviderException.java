package com.eainde.salary.provider;

/**
 * Transport-level failure of an observation provider.
 */
public class ObservationProviderException extends RuntimeException {

    public ObservationProviderException(String message) {
        super(message);
    }

    public ObservationProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
