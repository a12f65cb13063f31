package com.koni.glucose.infrastructure.web.exception;

import com.koni.glucose.domain.exception.AuthenticationException;
import com.koni.glucose.domain.exception.DataFetchException;
import com.koni.glucose.domain.exception.MalformedPayloadException;
import com.koni.glucose.domain.exception.RemoteServiceUnavailableException;
import com.koni.glucose.domain.exception.ReportRenderingException;
import com.koni.glucose.domain.exception.ServiceReportedException;
import com.koni.glucose.domain.exception.ValidationException;
import com.koni.glucose.infrastructure.web.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST API endpoints.
 * Every failure of a report request ends here and is answered with an
 * ErrorResponse; nothing is allowed to escape and affect other requests.
 *
 * The body is JSON unless the client explicitly accepts text/html (a browser
 * submitting the options form), in which case it is written as an HTML page
 * by {@link ErrorResponseHtmlConverter}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle validation exceptions.
     * Returns 400 Bad Request when the submitted form is invalid.
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException ex, HttpServletRequest request) {
        log.warn("Validation error: {}", ex.getMessage());
        return respond(request, HttpStatus.BAD_REQUEST, new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            ex.getMessage()
        ));
    }

    /**
     * Handle form binding and Bean Validation failures.
     * Returns 400 Bad Request with the violated constraints' messages.
     * MethodArgumentNotValidException is a BindException, so @Valid failures land here too.
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorResponse> handleBindException(BindException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .sorted()
            .collect(Collectors.joining("; "));
        log.warn("Validation error: {}", message);
        return respond(request, HttpStatus.BAD_REQUEST, new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(),
            "VALIDATION_ERROR",
            message
        ));
    }

    /**
     * Handle failed logins.
     * Returns 401 Unauthorized with the status text Tidepool answered with.
     */
    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationException(AuthenticationException ex, HttpServletRequest request) {
        log.warn("Tidepool authorization failed: {}", ex.getMessage());
        return respond(request, HttpStatus.UNAUTHORIZED, new ErrorResponse(
            HttpStatus.UNAUTHORIZED.value(),
            "AUTHORIZATION_FAILED",
            "Authorization call: bad request response " + ex.getStatus() + " " + ex.getStatusText()
        ));
    }

    /**
     * Handle failed data calls.
     * Returns 502 Bad Gateway with the status text Tidepool answered with.
     */
    @ExceptionHandler(DataFetchException.class)
    public ResponseEntity<ErrorResponse> handleDataFetchException(DataFetchException ex, HttpServletRequest request) {
        log.warn("Tidepool data call failed: {}", ex.getMessage());
        return respond(request, HttpStatus.BAD_GATEWAY, new ErrorResponse(
            HttpStatus.BAD_GATEWAY.value(),
            "DATA_FETCH_FAILED",
            "Data API call: unexpected response status " + ex.getStatus() + " " + ex.getStatusText()
        ));
    }

    /**
     * Handle errors reported by Tidepool in the data response body.
     * Returns 422 Unprocessable Entity with the service's own error fields.
     */
    @ExceptionHandler(ServiceReportedException.class)
    public ResponseEntity<ErrorResponse> handleServiceReportedException(ServiceReportedException ex, HttpServletRequest request) {
        log.warn("Tidepool reported an error: {}", ex.getServiceError());
        return respond(request, HttpStatus.UNPROCESSABLE_ENTITY, new ErrorResponse(
            HttpStatus.UNPROCESSABLE_ENTITY.value(),
            "TIDEPOOL_ERROR",
            ex.getServiceError().getMessage(),
            ex.getServiceError()
        ));
    }

    /**
     * Handle responses that match neither known shape.
     * Returns 502 Bad Gateway; the user cannot fix this.
     */
    @ExceptionHandler(MalformedPayloadException.class)
    public ResponseEntity<ErrorResponse> handleMalformedPayloadException(MalformedPayloadException ex, HttpServletRequest request) {
        log.error("Malformed Tidepool payload: {}", ex.getMessage(), ex);
        return respond(request, HttpStatus.BAD_GATEWAY, new ErrorResponse(
            HttpStatus.BAD_GATEWAY.value(),
            "MALFORMED_PAYLOAD",
            "Tidepool returned a response that could not be understood"
        ));
    }

    /**
     * Handle unreachable Tidepool.
     * Returns 503 Service Unavailable on connection failures, timeouts and an open circuit.
     */
    @ExceptionHandler(RemoteServiceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleRemoteServiceUnavailableException(RemoteServiceUnavailableException ex, HttpServletRequest request) {
        log.error("Tidepool unavailable: {}", ex.getMessage(), ex);
        return respond(request, HttpStatus.SERVICE_UNAVAILABLE, new ErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE.value(),
            "SERVICE_UNAVAILABLE",
            "Service temporarily unavailable"
        ));
    }

    /**
     * Handle document rendering failures.
     * Returns 500 Internal Server Error.
     */
    @ExceptionHandler(ReportRenderingException.class)
    public ResponseEntity<ErrorResponse> handleReportRenderingException(ReportRenderingException ex, HttpServletRequest request) {
        log.error("Report rendering failed: {}", ex.getMessage(), ex);
        return respond(request, HttpStatus.INTERNAL_SERVER_ERROR, new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "RENDERING_FAILED",
            "The report could not be generated"
        ));
    }

    /**
     * Handle all other unexpected exceptions.
     * Returns 500 Internal Server Error for unhandled exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error occurred: {}", ex.getMessage(), ex);
        return respond(request, HttpStatus.INTERNAL_SERVER_ERROR, new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            "INTERNAL_ERROR",
            "Internal server error"
        ));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpServletRequest request, HttpStatus status,
                                                         ErrorResponse body) {
        return ResponseEntity.status(status)
            .contentType(acceptsHtml(request) ? MediaType.TEXT_HTML : MediaType.APPLICATION_JSON)
            .body(body);
    }

    /**
     * True only when text/html is listed explicitly; wildcards keep the JSON default.
     */
    static boolean acceptsHtml(HttpServletRequest request) {
        String accept = request.getHeader(HttpHeaders.ACCEPT);
        if (accept == null || accept.isBlank()) {
            return false;
        }
        try {
            return MediaType.parseMediaTypes(accept).stream()
                .anyMatch(MediaType.TEXT_HTML::equalsTypeAndSubtype);
        } catch (InvalidMediaTypeException e) {
            log.debug("Ignoring unparseable Accept header '{}': {}", accept, e.getMessage());
            return false;
        }
    }
}
