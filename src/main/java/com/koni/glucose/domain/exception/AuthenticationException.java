package com.koni.glucose.domain.exception;

/**
 * Exception thrown when login fails: a non-200 login response, or a 200
 * response without a usable session token or account identifier.
 */
public class AuthenticationException extends RemoteCallException {

    public AuthenticationException(int status, String statusText) {
        super("Authorization call failed: " + status + " " + statusText, status, statusText);
    }

    public AuthenticationException(String message, int status, String statusText) {
        super(message, status, statusText);
    }

    public AuthenticationException(String message, int status, String statusText, Throwable cause) {
        super(message, status, statusText, cause);
    }
}
