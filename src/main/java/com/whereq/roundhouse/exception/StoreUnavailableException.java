package com.whereq.roundhouse.exception;

/**
 * Exception thrown when the coordination store cannot be reached.
 * The failed operation can be retried as a whole.
 */
public class StoreUnavailableException extends DispatchException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
