package com.koni.glucose.infrastructure.web.controller;

import com.koni.glucose.application.query.GenerateGlucoseReportQuery;
import com.koni.glucose.application.query.GenerateGlucoseReportQueryHandler;
import com.koni.glucose.domain.exception.ValidationException;
import com.koni.glucose.domain.model.Credentials;
import com.koni.glucose.domain.model.DateRange;
import com.koni.glucose.domain.model.GlucoseReport;
import com.koni.glucose.infrastructure.web.dto.GlucoseReportRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * REST controller for glucose reports.
 *
 * Endpoints:
 * - POST /opts: form target of the options page (static/index.html)
 * - POST /api/v1/reports/glucose: same operation under the versioned API path
 *
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class GlucoseReportController {

    static final String REPORT_FILENAME = "tidepool.pdf";

    private final GenerateGlucoseReportQueryHandler queryHandler;

    /**
     * Logs in to Tidepool with the submitted credentials, retrieves the smbg
     * readings in the optional date range and answers with the PDF report.
     *
     * Example request:
     * POST /opts
     * Content-Type: application/x-www-form-urlencoded
     *
     * useremail=jane@example.org&password=secret&startdate=2021-01-01&enddate=&datatype=smbg
     *
     * @param request the submitted form fields
     * @return 200 OK with the application/pdf document, shown inline
     */
    @PostMapping(path = {"/opts", "/api/v1/reports/glucose"},
            consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<byte[]> generateReport(@ModelAttribute @Valid GlucoseReportRequest request) {
        log.info("Received glucose report request: {}", request);

        GenerateGlucoseReportQuery query = new GenerateGlucoseReportQuery(
                new Credentials(request.getUseremail(), request.getPassword()),
                DateRange.of(parseDate("startdate", request.getStartdate()),
                        parseDate("enddate", request.getEnddate())),
                request.getDatatype()
        );

        GlucoseReport report = queryHandler.handle(query);
        byte[] document = report.getDocument();

        log.info("Returning glucose report: readings={}, bytes={}",
                report.getReadingCount(), document.length);

        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.inline().filename(REPORT_FILENAME).build().toString())
                .body(document);
    }

    /**
     * Parses an optional yyyy-MM-dd form field; blank means absent.
     */
    static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " must be a date in yyyy-MM-dd format", e);
        }
    }
}
