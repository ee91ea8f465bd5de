package com.eainde.salary.extraction;

/**
 * Raised when profile text yields no usable title, company or experience.
 * This is the only pipeline failure surfaced to callers.
 */
public class ProfileExtractionException extends RuntimeException {

    public ProfileExtractionException(String message) {
        super(message);
    }

    public ProfileExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
