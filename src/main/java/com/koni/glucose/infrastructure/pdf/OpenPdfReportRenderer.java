package com.koni.glucose.infrastructure.pdf;

import com.koni.glucose.application.port.ReportRenderer;
import com.koni.glucose.domain.exception.ReportRenderingException;
import com.koni.glucose.domain.model.NormalizedReading;
import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.PageSize;
import com.lowagie.text.Paragraph;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * OpenPDF implementation of the ReportRenderer port.
 *
 * Produces a US-Letter portrait document with one table row per reading.
 * The renderer only holds the immutable {@link ReportLayout}; the document,
 * writer, page decorator and output buffer are created for every call.
 */
@Slf4j
@Component
public class OpenPdfReportRenderer implements ReportRenderer {

    static final String EMPTY_MESSAGE = "No glucose readings were found for the selected period.";

    private static final float RIGHT_MARGIN = ReportLayout.inches(1f);
    private static final float BOTTOM_MARGIN = ReportLayout.inches(0.8f);

    private final ReportLayout layout;

    @Autowired
    public OpenPdfReportRenderer(@Value("${report.title:" + ReportLayout.DEFAULT_TITLE + "}") String title) {
        this(ReportLayout.withTitle(title));
    }

    public OpenPdfReportRenderer(ReportLayout layout) {
        this.layout = layout;
    }

    @Override
    public byte[] render(List<NormalizedReading> readings) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        Document document = new Document(PageSize.LETTER,
                layout.getLeftIndent(), RIGHT_MARGIN,
                GlucoseReportPageDecorator.headerBandHeight(layout), BOTTOM_MARGIN);
        GlucoseReportPageDecorator decorator = new GlucoseReportPageDecorator(layout);

        try {
            PdfWriter writer = PdfWriter.getInstance(document, output);
            writer.setPageEvent(decorator);

            document.open();
            if (readings.isEmpty()) {
                document.add(new Paragraph(EMPTY_MESSAGE, bodyFont()));
            } else {
                document.add(buildReadingTable(readings));
            }
            document.close();
        } catch (DocumentException e) {
            log.error("Failed to render glucose report: readings={}", readings.size(), e);
            throw new ReportRenderingException("Unable to render the glucose report", e);
        } catch (RuntimeException e) {
            log.error("Failed to render glucose report: readings={}", readings.size(), e);
            throw new ReportRenderingException("Unable to render the glucose report: " + e.getMessage(), e);
        }

        log.debug("Rendered glucose report: readings={}, pages={}, bytes={}",
                readings.size(), decorator.getPageCount(), output.size());
        return output.toByteArray();
    }

    /**
     * One row per reading, in input order. The column header is drawn by the
     * page decorator, so the table holds data rows only.
     */
    PdfPTable buildReadingTable(List<NormalizedReading> readings) {
        Font font = bodyFont();
        PdfPTable table = new PdfPTable(layout.getColumnCount());
        table.setTotalWidth(layout.getTableWidth());
        table.setLockedWidth(true);
        table.setHorizontalAlignment(Element.ALIGN_LEFT);
        for (NormalizedReading reading : readings) {
            table.addCell(GlucoseReportPageDecorator.cell(reading.getDate(), font, layout));
            table.addCell(GlucoseReportPageDecorator.cell(reading.getTime(), font, layout));
            table.addCell(GlucoseReportPageDecorator.cell(reading.getValue(), font, layout));
        }
        return table;
    }

    ReportLayout getLayout() {
        return layout;
    }

    private static Font bodyFont() {
        return FontFactory.getFont(FontFactory.HELVETICA, GlucoseReportPageDecorator.BODY_SIZE);
    }
}
