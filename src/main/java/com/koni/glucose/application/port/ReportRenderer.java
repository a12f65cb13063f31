package com.koni.glucose.application.port;

import com.koni.glucose.domain.model.NormalizedReading;

import java.util.List;

/**
 * Port interface for turning readings into a printable document.
 *
 * Implementations must not keep per-document state between calls: every
 * invocation builds and returns its own document.
 */
public interface ReportRenderer {

    /**
     * Renders the readings, in the given order, as a paginated table.
     *
     * @param readings the readings to render; may be empty
     * @return the finished document
     * @throws com.koni.glucose.domain.exception.ReportRenderingException if the document cannot be built
     */
    byte[] render(List<NormalizedReading> readings);
}
