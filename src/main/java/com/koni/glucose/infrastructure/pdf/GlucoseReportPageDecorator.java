package com.koni.glucose.infrastructure.pdf;

import com.lowagie.text.Document;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.Phrase;
import com.lowagie.text.Rectangle;
import com.lowagie.text.pdf.BaseFont;
import com.lowagie.text.pdf.ColumnText;
import com.lowagie.text.pdf.PdfContentByte;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfPageEventHelper;
import com.lowagie.text.pdf.PdfTemplate;
import com.lowagie.text.pdf.PdfWriter;

/**
 * Page events of one glucose report document.
 *
 * On every page start it draws the title band and the column header row; on
 * every page end it draws the "Page X / Y" footer. Y is not known until the
 * document is closed, so the footer references a template that is filled in
 * by {@link #onCloseDocument(PdfWriter, Document)}.
 *
 * An instance belongs to exactly one document.
 */
class GlucoseReportPageDecorator extends PdfPageEventHelper {

    static final float TITLE_SIZE = 15f;
    static final float FOOTER_SIZE = 8f;
    static final float BODY_SIZE = 12f;

    private static final float TITLE_BASELINE = ReportLayout.inches(0.5f);
    private static final float HEADER_TOP = ReportLayout.inches(0.7f);
    private static final float FOOTER_BASELINE = ReportLayout.inches(0.5f);
    private static final float TOTAL_TEMPLATE_WIDTH = 30f;

    private final ReportLayout layout;
    private final Font titleFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, TITLE_SIZE);
    private final Font headerFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, BODY_SIZE);
    private final BaseFont footerFont = FontFactory.getFont(FontFactory.HELVETICA_OBLIQUE, FOOTER_SIZE)
            .getCalculatedBaseFont(false);

    private PdfTemplate totalPages;
    private int pageCount;

    GlucoseReportPageDecorator(ReportLayout layout) {
        this.layout = layout;
    }

    /**
     * Top margin the document needs so that body rows start below the header band.
     */
    static float headerBandHeight(ReportLayout layout) {
        return HEADER_TOP + layout.getRowHeight();
    }

    @Override
    public void onOpenDocument(PdfWriter writer, Document document) {
        totalPages = writer.getDirectContent().createTemplate(TOTAL_TEMPLATE_WIDTH, FOOTER_SIZE + 2f);
    }

    @Override
    public void onStartPage(PdfWriter writer, Document document) {
        PdfContentByte canvas = writer.getDirectContent();
        Rectangle page = document.getPageSize();

        ColumnText.showTextAligned(canvas, Element.ALIGN_CENTER,
                new Phrase(layout.getTitle(), titleFont),
                page.getWidth() / 2, page.getHeight() - TITLE_BASELINE, 0);

        buildColumnHeader().writeSelectedRows(0, -1,
                layout.getLeftIndent(), page.getHeight() - HEADER_TOP, canvas);
    }

    @Override
    public void onEndPage(PdfWriter writer, Document document) {
        pageCount = writer.getPageNumber();

        String text = "Page " + pageCount + " / ";
        float textWidth = footerFont.getWidthPoint(text, FOOTER_SIZE);
        float x = (document.getPageSize().getWidth() - textWidth - footerFont.getWidthPoint("9", FOOTER_SIZE)) / 2;

        PdfContentByte canvas = writer.getDirectContent();
        canvas.beginText();
        canvas.setFontAndSize(footerFont, FOOTER_SIZE);
        canvas.setTextMatrix(x, FOOTER_BASELINE);
        canvas.showText(text);
        canvas.endText();
        canvas.addTemplate(totalPages, x + textWidth, FOOTER_BASELINE);
    }

    @Override
    public void onCloseDocument(PdfWriter writer, Document document) {
        totalPages.beginText();
        totalPages.setFontAndSize(footerFont, FOOTER_SIZE);
        totalPages.setTextMatrix(0, 0);
        totalPages.showText(String.valueOf(pageCount));
        totalPages.endText();
    }

    int getPageCount() {
        return pageCount;
    }

    PdfPTable buildColumnHeader() {
        PdfPTable header = new PdfPTable(layout.getColumnCount());
        header.setTotalWidth(layout.getTableWidth());
        header.setLockedWidth(true);
        for (String label : layout.getColumnLabels()) {
            header.addCell(cell(label, headerFont, layout));
        }
        return header;
    }

    /**
     * Bordered, centered cell of the fixed row height.
     */
    static PdfPCell cell(String text, Font font, ReportLayout layout) {
        PdfPCell cell = new PdfPCell(new Phrase(text, font));
        cell.setBorder(Rectangle.BOX);
        cell.setHorizontalAlignment(Element.ALIGN_CENTER);
        cell.setVerticalAlignment(Element.ALIGN_MIDDLE);
        cell.setFixedHeight(layout.getRowHeight());
        return cell;
    }
}
