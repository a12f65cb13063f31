package com.koni.glucose.domain.exception;

/**
 * Exception thrown when the PDF document cannot be built.
 */
public class ReportRenderingException extends RuntimeException {

    public ReportRenderingException(String message) {
        super(message);
    }

    public ReportRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
