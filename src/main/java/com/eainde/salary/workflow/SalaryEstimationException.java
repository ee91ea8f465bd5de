package com.eainde.salary.workflow;

/**
 * Unexpected pipeline failure, anything other than an unusable profile.
 */
public class SalaryEstimationException extends RuntimeException {

    public SalaryEstimationException(String message) {
        super(message);
    }

    public SalaryEstimationException(String message, Throwable cause) {
        super(message, cause);
    }
}
