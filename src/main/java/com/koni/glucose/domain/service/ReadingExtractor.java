package com.koni.glucose.domain.service;

import com.koni.glucose.domain.model.NormalizedReading;
import com.koni.glucose.domain.model.RawMeasurement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the raw measurement feed into display-ready glucose readings.
 *
 * Only self-managed blood glucose entries ({@code smbg}) are kept, in feed
 * order. The device-local timestamp is split into date and time without any
 * timezone conversion, and the value is converted from mmol/L to mg/dL.
 */
@Slf4j
public class ReadingExtractor {

    public static final String SUPPORTED_TYPE = "smbg";

    /** mg/dL per mmol/L for glucose. */
    static final int MMOL_TO_MG_DL = 18;

    static final String EXPECTED_UNITS = "mmol/L";

    private static final int DEVICE_TIME_MIN_LENGTH = 19;

    /**
     * Extracts the supported readings from the feed.
     *
     * @param measurements the feed entries in arrival order
     * @return the readings in the same order; empty if nothing matched
     */
    public List<NormalizedReading> extract(List<RawMeasurement> measurements) {
        List<NormalizedReading> readings = new ArrayList<>();
        for (RawMeasurement measurement : measurements) {
            if (measurement == null || !SUPPORTED_TYPE.equals(measurement.getType())) {
                continue;
            }
            String deviceTime = measurement.getDeviceTime();
            if (deviceTime == null || deviceTime.length() < DEVICE_TIME_MIN_LENGTH) {
                log.warn("Skipping {} entry with unusable deviceTime: id={}, deviceTime={}",
                        SUPPORTED_TYPE, measurement.getId(), deviceTime);
                continue;
            }
            if (measurement.getValue() == null) {
                log.warn("Skipping {} entry without value: id={}", SUPPORTED_TYPE, measurement.getId());
                continue;
            }
            if (measurement.getUnits() != null && !EXPECTED_UNITS.equalsIgnoreCase(measurement.getUnits())) {
                // Conversion still assumes mmol/L
                log.warn("Unexpected units on {} entry: id={}, units={}",
                        SUPPORTED_TYPE, measurement.getId(), measurement.getUnits());
            }
            readings.add(new NormalizedReading(
                    deviceTime.substring(0, 10),
                    deviceTime.substring(11, 19),
                    toDisplayValue(measurement.getValue())
            ));
        }
        log.debug("Extracted {} readings from {} feed entries", readings.size(), measurements.size());
        return readings;
    }

    /**
     * Converts a mmol/L value to mg/dL, truncated toward zero.
     */
    public static String toDisplayValue(double mmolPerLiter) {
        return Long.toString((long) (mmolPerLiter * MMOL_TO_MG_DL));
    }
}
