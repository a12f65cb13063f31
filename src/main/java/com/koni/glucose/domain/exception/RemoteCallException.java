package com.koni.glucose.domain.exception;

import lombok.Getter;

/**
 * Base class for failures where the health-data service answered with an
 * unexpected HTTP status. Carries the status code and reason phrase so they
 * can be shown to the user.
 */
@Getter
public abstract class RemoteCallException extends RuntimeException {

    private final int status;
    private final String statusText;

    protected RemoteCallException(String message, int status, String statusText) {
        super(message);
        this.status = status;
        this.statusText = statusText;
    }

    protected RemoteCallException(String message, int status, String statusText, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.statusText = statusText;
    }
}
