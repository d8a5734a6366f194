package com.whereq.roundhouse.exception;

/**
 * Exception thrown when a job description is malformed. Raised before any state is written.
 */
public class JobValidationException extends DispatchException {
    public JobValidationException(String message) {
        super(message);
    }
}
