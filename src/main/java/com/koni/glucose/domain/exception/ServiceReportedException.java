package com.koni.glucose.domain.exception;

import com.koni.glucose.domain.model.ServiceError;
import lombok.Getter;

/**
 * Exception thrown when the measurement feed turned out to be the service's
 * own error object. The user can usually fix the cause (credentials, date range).
 */
@Getter
public class ServiceReportedException extends RuntimeException {

    private final ServiceError serviceError;

    public ServiceReportedException(ServiceError serviceError) {
        super("Tidepool reported an error: status=" + serviceError.getStatus()
                + ", code=" + serviceError.getCode()
                + ", message=" + serviceError.getMessage());
        this.serviceError = serviceError;
    }
}
