package com.whereq.roundhouse.exception;

/**
 * Base class for failures surfaced by the dispatch queue
 */
public class DispatchException extends RuntimeException {
    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
