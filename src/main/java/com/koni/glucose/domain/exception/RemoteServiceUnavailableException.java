package com.koni.glucose.domain.exception;

/**
 * Exception thrown when the health-data service cannot be reached: connection
 * failure, timeout, or the circuit breaker rejecting the call.
 */
public class RemoteServiceUnavailableException extends RuntimeException {

    public RemoteServiceUnavailableException(String message) {
        super(message);
    }

    public RemoteServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
