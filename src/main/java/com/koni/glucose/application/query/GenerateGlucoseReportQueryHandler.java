package com.koni.glucose.application.query;

import com.koni.glucose.application.port.HealthDataClient;
import com.koni.glucose.application.port.ReportRenderer;
import com.koni.glucose.application.service.MeasurementFeedClassifier;
import com.koni.glucose.domain.exception.ServiceReportedException;
import com.koni.glucose.domain.model.FeedClassification;
import com.koni.glucose.domain.model.GlucoseReport;
import com.koni.glucose.domain.model.NormalizedReading;
import com.koni.glucose.domain.model.RawMeasurement;
import com.koni.glucose.domain.model.Session;
import com.koni.glucose.domain.service.ReadingExtractor;
import com.koni.glucose.infrastructure.observability.GlucoseReportMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Query handler that produces a glucose report.
 *
 * Pipeline:
 * - Log in to the health-data service
 * - Fetch the raw measurement feed
 * - Classify the body as measurements or a service error
 * - Extract the smbg readings
 * - Render them as a PDF
 *
 * Every stage works on values owned by the current call, so concurrent
 * requests never share a document or a buffer.
 */
@Service
@Slf4j
public class GenerateGlucoseReportQueryHandler {

    private final HealthDataClient healthDataClient;
    private final MeasurementFeedClassifier classifier;
    private final ReportRenderer reportRenderer;
    private final GlucoseReportMetrics metrics;
    private final ReadingExtractor readingExtractor = new ReadingExtractor();

    public GenerateGlucoseReportQueryHandler(HealthDataClient healthDataClient,
                                             MeasurementFeedClassifier classifier,
                                             ReportRenderer reportRenderer,
                                             GlucoseReportMetrics metrics) {
        this.healthDataClient = healthDataClient;
        this.classifier = classifier;
        this.reportRenderer = reportRenderer;
        this.metrics = metrics;
    }

    /**
     * Handles the query.
     *
     * @param query the report request
     * @return the rendered report; a report without readings is a valid result
     * @throws com.koni.glucose.domain.exception.ValidationException if the query is invalid
     * @throws ServiceReportedException if the service answered the data call with its error object
     */
    @Observed(name = "query.handler", contextualName = "generate-glucose-report")
    public GlucoseReport handle(GenerateGlucoseReportQuery query) {
        log.debug("Handling GenerateGlucoseReportQuery: user={}, dateRange={}, dataType={}",
                query.getCredentials() != null ? query.getCredentials().getIdentifier() : null,
                query.getDateRange(), query.getDataType());

        return metrics.recordGenerationTime(() -> {
            metrics.recordReportRequested();
            try {
                GlucoseReport report = generate(query);
                metrics.recordReportGenerated(report.getReadingCount());
                return report;
            } catch (RuntimeException e) {
                metrics.recordReportFailed(e.getClass().getSimpleName());
                throw e;
            }
        });
    }

    private GlucoseReport generate(GenerateGlucoseReportQuery query) {
        // 1. Validate input
        query.validate();

        // 2. Authenticate
        Session session = healthDataClient.login(query.getCredentials());
        log.info("Logged in to Tidepool: accountId={}", session.getAccountId());

        // 3. Fetch
        byte[] body = healthDataClient.fetchMeasurements(session, query.getDataType(), query.getDateRange());

        // 4. Classify
        FeedClassification classification = classifier.classify(body);
        if (!classification.isSuccess()) {
            FeedClassification.Failure failure = (FeedClassification.Failure) classification;
            throw new ServiceReportedException(failure.getError());
        }
        List<RawMeasurement> measurements = ((FeedClassification.Success) classification).getMeasurements();

        // 5. Extract
        List<NormalizedReading> readings = readingExtractor.extract(measurements);
        if (readings.isEmpty()) {
            log.info("No results were returned from Tidepool: accountId={}, dateRange={}",
                    session.getAccountId(), query.getDateRange());
        }

        // 6. Render
        byte[] document = reportRenderer.render(readings);
        log.info("Glucose report rendered: accountId={}, readings={}, bytes={}",
                session.getAccountId(), readings.size(), document.length);

        return new GlucoseReport(document, readings.size());
    }
}
