package com.koni.glucose.domain.model;

import lombok.Getter;

/**
 * A rendered glucose report: the PDF document and the number of readings in it.
 * The document bytes are copied on the way in and on the way out.
 */
public final class GlucoseReport {

    public static final String MEDIA_TYPE = "application/pdf";

    private final byte[] document;
    @Getter
    private final int readingCount;

    public GlucoseReport(byte[] document, int readingCount) {
        this.document = document.clone();
        this.readingCount = readingCount;
    }

    public byte[] getDocument() {
        return document.clone();
    }

    public boolean isEmpty() {
        return readingCount == 0;
    }
}
