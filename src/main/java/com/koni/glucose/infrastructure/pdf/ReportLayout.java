package com.koni.glucose.infrastructure.pdf;

import lombok.Getter;

import java.util.List;

/**
 * Immutable layout parameters of the glucose report: title, column labels and
 * the fixed cell geometry. Lengths are in PDF points (1/72 inch).
 */
@Getter
public final class ReportLayout {

    static final float POINTS_PER_INCH = 72f;

    public static final String DEFAULT_TITLE = "Glucose Values";
    public static final List<String> DEFAULT_COLUMNS = List.of("Date", "Time", "Glucose value");

    private final String title;
    private final List<String> columnLabels;
    private final float columnWidth;
    private final float rowHeight;
    private final float leftIndent;

    public ReportLayout(String title, List<String> columnLabels, float columnWidth, float rowHeight, float leftIndent) {
        if (columnLabels == null || columnLabels.isEmpty()) {
            throw new IllegalArgumentException("at least one column label is required");
        }
        this.title = title;
        this.columnLabels = List.copyOf(columnLabels);
        this.columnWidth = columnWidth;
        this.rowHeight = rowHeight;
        this.leftIndent = leftIndent;
    }

    /**
     * Layout with the given title, three 1.7 in columns, 0.3 in rows and a 1.35 in indent.
     */
    public static ReportLayout withTitle(String title) {
        return new ReportLayout(title, DEFAULT_COLUMNS,
                inches(1.7f), inches(0.3f), inches(1.35f));
    }

    public static ReportLayout defaults() {
        return withTitle(DEFAULT_TITLE);
    }

    public int getColumnCount() {
        return columnLabels.size();
    }

    public float getTableWidth() {
        return columnWidth * columnLabels.size();
    }

    static float inches(float inches) {
        return inches * POINTS_PER_INCH;
    }
}
