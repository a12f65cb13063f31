package com.koni.glucose.application.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.koni.glucose.domain.exception.MalformedPayloadException;
import com.koni.glucose.domain.model.FeedClassification;
import com.koni.glucose.domain.model.RawMeasurement;
import com.koni.glucose.domain.model.ServiceError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Decides whether a measurement-feed body is data or an error.
 *
 * The service answers 200 both for the measurement array and, in some failure
 * modes, for an error object, so the JSON shape is the only discriminator:
 * the body is parsed as an array first and as an error object second. Both
 * parses must consume the whole body; trailing content makes it malformed.
 */
@Slf4j
@Service
public class MeasurementFeedClassifier {

    private static final TypeReference<List<RawMeasurement>> MEASUREMENT_LIST = new TypeReference<>() {
    };

    private final ObjectReader measurementReader;
    private final ObjectReader errorReader;

    public MeasurementFeedClassifier(ObjectMapper objectMapper) {
        this.measurementReader = objectMapper.readerFor(MEASUREMENT_LIST)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.errorReader = objectMapper.readerFor(ServiceError.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Classifies the given response body.
     *
     * @param body the raw response body
     * @return a success holding the measurements, or a failure holding the service error
     * @throws MalformedPayloadException if the body matches neither shape
     */
    public FeedClassification classify(byte[] body) {
        if (body == null || body.length == 0) {
            throw new MalformedPayloadException("Empty response body");
        }

        try {
            List<RawMeasurement> measurements = measurementReader.readValue(body);
            if (measurements != null) {
                log.debug("Response classified as measurement feed: {} entries", measurements.size());
                return FeedClassification.success(measurements);
            }
        } catch (IOException e) {
            log.debug("Response is not a measurement array, trying error shape: {}", e.getMessage());
        }

        try {
            ServiceError error = errorReader.readValue(body);
            if (error != null) {
                log.info("Response classified as service error: status={}, code={}", error.getStatus(), error.getCode());
                return FeedClassification.failure(error);
            }
        } catch (IOException e) {
            log.warn("Response matches neither the measurement nor the error shape: {}", e.getMessage());
            throw new MalformedPayloadException("Unable to decode response as measurements or as an error", e);
        }
        throw new MalformedPayloadException("Response body is JSON null");
    }
}
