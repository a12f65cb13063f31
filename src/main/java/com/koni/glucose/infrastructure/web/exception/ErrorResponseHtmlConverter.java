package com.koni.glucose.infrastructure.web.exception;

import com.koni.glucose.domain.model.ServiceError;
import com.koni.glucose.infrastructure.web.dto.ErrorResponse;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes an {@link ErrorResponse} as a small HTML page for browsers that
 * submitted the options form. Spring Boot registers every
 * HttpMessageConverter bean with MVC; this one only ever writes text/html.
 */
@Component
public class ErrorResponseHtmlConverter extends AbstractHttpMessageConverter<ErrorResponse> {

    public ErrorResponseHtmlConverter() {
        super(StandardCharsets.UTF_8, MediaType.TEXT_HTML);
    }

    @Override
    protected boolean supports(Class<?> clazz) {
        return ErrorResponse.class.isAssignableFrom(clazz);
    }

    @Override
    protected boolean canRead(MediaType mediaType) {
        return false;
    }

    @Override
    protected ErrorResponse readInternal(Class<? extends ErrorResponse> clazz, HttpInputMessage inputMessage) {
        throw new HttpMessageNotReadableException("ErrorResponse is write-only", inputMessage);
    }

    @Override
    protected void writeInternal(ErrorResponse response, HttpOutputMessage outputMessage) throws IOException {
        StreamUtils.copy(render(response), StandardCharsets.UTF_8, outputMessage.getBody());
    }

    static String render(ErrorResponse response) {
        StringBuilder html = new StringBuilder()
                .append("<!DOCTYPE html>\n<html>\n<head><meta charset=\"utf-8\"><title>Glucose report error</title></head>\n<body>\n")
                .append("<h1>The glucose report could not be generated</h1>\n")
                .append("<p>").append(escape(response.getMessage())).append("</p>\n")
                .append("<p>Status: ").append(response.getStatus())
                .append(" (").append(escape(response.getError())).append(")</p>\n");

        ServiceError serviceError = response.getServiceError();
        if (serviceError != null) {
            html.append("<h2>Tidepool error</h2>\n<ul>\n")
                    .append("<li>Status: ").append(serviceError.getStatus()).append("</li>\n")
                    .append("<li>Id: ").append(escape(serviceError.getId())).append("</li>\n")
                    .append("<li>Code: ").append(escape(serviceError.getCode())).append("</li>\n")
                    .append("<li>Message: ").append(escape(serviceError.getMessage())).append("</li>\n")
                    .append("</ul>\n");
        }
        return html.append("<p><a href=\"/\">Back</a></p>\n</body>\n</html>\n").toString();
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
