package com.koni.glucose.domain.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of classifying a measurement-feed response body: either the
 * measurement array or the error object the service returned instead.
 */
public abstract class FeedClassification {

    private FeedClassification() {
    }

    public static Success success(List<RawMeasurement> measurements) {
        return new Success(measurements);
    }

    public static Failure failure(ServiceError error) {
        return new Failure(error);
    }

    public abstract boolean isSuccess();

    /**
     * The body was a measurement array. The list may be empty.
     */
    @Getter
    public static final class Success extends FeedClassification {

        private final List<RawMeasurement> measurements;

        private Success(List<RawMeasurement> measurements) {
            this.measurements = Collections.unmodifiableList(new ArrayList<>(measurements));
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * The body was the service's error object.
     */
    @Getter
    public static final class Failure extends FeedClassification {

        private final ServiceError error;

        private Failure(ServiceError error) {
            this.error = error;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
