package com.koni.glucose.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One entry of the measurement feed.
 *
 * Every subtype shares this schema and carries its own sparse fields
 * (payload, annotations, device metadata); only the fields needed to build a
 * reading are mapped and everything else is ignored.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RawMeasurement {

    private final String id;
    private final String type;
    private final String deviceTime;
    private final String time;
    private final Double value;
    private final String units;

    @JsonCreator
    public RawMeasurement(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("deviceTime") String deviceTime,
            @JsonProperty("time") String time,
            @JsonProperty("value") Double value,
            @JsonProperty("units") String units) {
        this.id = id;
        this.type = type;
        this.deviceTime = deviceTime;
        this.time = time;
        this.value = value;
        this.units = units;
    }

    public static RawMeasurement of(String type, String deviceTime, Double value, String units) {
        return new RawMeasurement(null, type, deviceTime, null, value, units);
    }
}
