package com.koni.glucose.domain.model;

import com.koni.glucose.domain.exception.ValidationException;
import com.koni.glucose.tags.UnitTest;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for DateRange.
 * Tests query-string construction for every combination of bounds.
 */
@UnitTest
class DateRangeTest {

    @Test
    void shouldRenderStartBoundOnly() {
        DateRange range = DateRange.of(LocalDate.parse("2021-01-01"), null);

        assertThat(range.toQuerySuffix()).isEqualTo("&startDate=2021-01-01T01:00:00.000Z");
        assertThat(range.toQuerySuffix()).doesNotContain("endDate");
    }

    @Test
    void shouldRenderEndBoundOnly() {
        DateRange range = DateRange.of(null, LocalDate.parse("2021-03-31"));

        assertThat(range.toQuerySuffix()).isEqualTo("&endDate=2021-03-31T01:00:00.000Z");
    }

    @Test
    void shouldRenderBothBoundsStartFirst() {
        DateRange range = DateRange.of(LocalDate.parse("2021-01-01"), LocalDate.parse("2021-03-31"));

        assertThat(range.toQuerySuffix())
                .isEqualTo("&startDate=2021-01-01T01:00:00.000Z&endDate=2021-03-31T01:00:00.000Z");
    }

    @Test
    void shouldRenderNothingWhenUnbounded() {
        assertThat(DateRange.of(null, null).toQuerySuffix()).isEmpty();
        assertThat(DateRange.unbounded().toQuerySuffix()).isEmpty();
        assertThat(DateRange.unbounded().isUnbounded()).isTrue();
    }

    @Test
    void shouldAcceptSameDayRange() {
        LocalDate day = LocalDate.parse("2021-02-14");

        DateRange range = DateRange.of(day, day);

        assertThat(range.start()).contains(day);
        assertThat(range.end()).contains(day);
    }

    @Test
    void shouldRejectStartAfterEnd() {
        assertThatThrownBy(() -> DateRange.of(LocalDate.parse("2021-02-01"), LocalDate.parse("2021-01-01")))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("startdate must not be after enddate");
    }
}
