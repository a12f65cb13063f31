package com.koni.glucose.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A glucose reading ready for display: device-local date and time plus the
 * value in mg/dL as an integer string.
 */
@Getter
@EqualsAndHashCode
public final class NormalizedReading {

    private final String date;
    private final String time;
    private final String value;

    public NormalizedReading(String date, String time, String value) {
        this.date = date;
        this.time = time;
        this.value = value;
    }

    @Override
    public String toString() {
        return "NormalizedReading{" +
                "date=" + date +
                ", time=" + time +
                ", value=" + value +
                '}';
    }
}
