package com.koni.glucose.domain.exception;

/**
 * Exception thrown when a report request does not meet the input rules
 * (missing credentials, unparseable dates, unsupported data type).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
