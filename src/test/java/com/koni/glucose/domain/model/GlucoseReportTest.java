package com.koni.glucose.domain.model;

import com.koni.glucose.tags.UnitTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class GlucoseReportTest {

    @Test
    void shouldNotExposeItsDocumentBuffer() {
        // Given
        byte[] source = {1, 2, 3};
        GlucoseReport report = new GlucoseReport(source, 1);

        // When
        source[0] = 9;
        report.getDocument()[1] = 9;

        // Then
        assertThat(report.getDocument()).containsExactly(1, 2, 3);
    }

    @Test
    void shouldBeEmptyWithoutReadings() {
        assertThat(new GlucoseReport(new byte[]{1}, 0).isEmpty()).isTrue();
        assertThat(new GlucoseReport(new byte[]{1}, 2).isEmpty()).isFalse();
    }
}
