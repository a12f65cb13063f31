package com.koni.glucose.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.koni.glucose.domain.model.ServiceError;

import java.time.Instant;

/**
 * DTO for error responses returned by the REST API.
 * Provides consistent error information to clients.
 *
 * {@code serviceError} is only present when the failure was reported by
 * Tidepool itself, so the user can see its status, id, code and message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final int status;
    private final String error;
    private final String message;
    private final Instant timestamp;
    private final ServiceError serviceError;

    public ErrorResponse(int status, String error, String message) {
        this(status, error, message, null);
    }

    public ErrorResponse(int status, String error, String message, ServiceError serviceError) {
        this.status = status;
        this.error = error;
        this.message = message;
        this.serviceError = serviceError;
        this.timestamp = Instant.now();
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ServiceError getServiceError() {
        return serviceError;
    }
}
