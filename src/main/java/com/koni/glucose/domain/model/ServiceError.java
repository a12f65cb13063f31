package com.koni.glucose.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Error body returned by the health-data service, e.g. for invalid credentials.
 * It is a JSON object, while a successful feed is a JSON array.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ServiceError {

    private final int status;
    private final String id;
    private final String code;
    private final String message;

    @JsonCreator
    public ServiceError(
            @JsonProperty("status") int status,
            @JsonProperty("id") String id,
            @JsonProperty("code") String code,
            @JsonProperty("message") String message) {
        this.status = status;
        this.id = id;
        this.code = code;
        this.message = message;
    }
}
