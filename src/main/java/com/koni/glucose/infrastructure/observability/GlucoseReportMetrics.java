package com.koni.glucose.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking report-generation metrics.
 * Provides counters, a reading-count summary and a generation timer.
 */
@Slf4j
@Component
public class GlucoseReportMetrics {

    static final String FAILED_COUNTER = "glucose.reports.failed.total";

    private final MeterRegistry registry;
    private final Counter reportsRequested;
    private final Counter reportsGenerated;
    private final Counter emptyReports;
    private final DistributionSummary readingsPerReport;
    private final Timer generationTime;

    public GlucoseReportMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.reportsRequested = Counter.builder("glucose.reports.requested.total")
                .description("Total report requests received")
                .register(registry);

        this.reportsGenerated = Counter.builder("glucose.reports.generated.total")
                .description("Total reports rendered successfully")
                .tag("type", "smbg")
                .register(registry);

        this.emptyReports = Counter.builder("glucose.reports.empty.total")
                .description("Total reports rendered without any reading")
                .register(registry);

        this.readingsPerReport = DistributionSummary.builder("glucose.readings.per_report")
                .description("Number of readings rendered per report")
                .register(registry);

        this.generationTime = Timer.builder("glucose.reports.generation.time")
                .description("Time to fetch, classify, extract and render a report")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    /**
     * Increment the counter for received report requests.
     */
    public void recordReportRequested() {
        reportsRequested.increment();
        log.debug("Report requested counter incremented");
    }

    /**
     * Record a successfully rendered report.
     *
     * @param readingCount number of readings in the report
     */
    public void recordReportGenerated(int readingCount) {
        reportsGenerated.increment();
        readingsPerReport.record(readingCount);
        if (readingCount == 0) {
            emptyReports.increment();
        }
        log.debug("Report generated counter incremented: readings={}", readingCount);
    }

    /**
     * Increment the failure counter for the given reason.
     *
     * @param reason short failure kind, e.g. the exception's simple name
     */
    public void recordReportFailed(String reason) {
        Counter.builder(FAILED_COUNTER)
                .description("Total report requests that failed")
                .tag("reason", reason)
                .register(registry)
                .increment();
        log.debug("Report failed counter incremented: reason={}", reason);
    }

    /**
     * Record the generation time of a report.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordGenerationTime(Supplier<T> operation) {
        return generationTime.record(operation);
    }
}
