package com.koni.glucose.domain.exception;

/**
 * Exception thrown when a response body is neither a measurement array nor an
 * error object. Indicates a change of the remote contract, not a user error.
 */
public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
