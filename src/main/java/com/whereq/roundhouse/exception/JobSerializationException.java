package com.whereq.roundhouse.exception;

/**
 * Exception thrown when a job, result or callback cannot be encoded or decoded
 */
public class JobSerializationException extends DispatchException {
    public JobSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
