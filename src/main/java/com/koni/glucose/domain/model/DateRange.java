package com.koni.glucose.domain.model;

import com.koni.glucose.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Optional date bounds for a measurement query. Either bound may be absent.
 *
 * The service expects full timestamps, so every present bound is sent as
 * {@code <date>T01:00:00.000Z}.
 */
@Getter
@EqualsAndHashCode
public final class DateRange {

    static final String TIME_OF_DAY_SUFFIX = "T01:00:00.000Z";

    private static final DateRange UNBOUNDED = new DateRange(null, null);

    private final LocalDate start;
    private final LocalDate end;

    private DateRange(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Creates a range from the given bounds; {@code null} means unbounded on that side.
     *
     * @throws ValidationException if both bounds are present and start is after end
     */
    public static DateRange of(LocalDate start, LocalDate end) {
        if (start == null && end == null) {
            return UNBOUNDED;
        }
        if (start != null && end != null && start.isAfter(end)) {
            throw new ValidationException("startdate must not be after enddate");
        }
        return new DateRange(start, end);
    }

    public static DateRange unbounded() {
        return UNBOUNDED;
    }

    public Optional<LocalDate> start() {
        return Optional.ofNullable(start);
    }

    public Optional<LocalDate> end() {
        return Optional.ofNullable(end);
    }

    public boolean isUnbounded() {
        return start == null && end == null;
    }

    /**
     * Renders the range as the query-string fragment appended to the data URL,
     * start bound first. Returns an empty string for an unbounded range.
     */
    public String toQuerySuffix() {
        StringBuilder query = new StringBuilder();
        if (start != null) {
            query.append("&startDate=").append(toTimestamp(start));
        }
        if (end != null) {
            query.append("&endDate=").append(toTimestamp(end));
        }
        return query.toString();
    }

    static String toTimestamp(LocalDate date) {
        return date + TIME_OF_DAY_SUFFIX;
    }

    @Override
    public String toString() {
        return "DateRange{start=" + start + ", end=" + end + "}";
    }
}
