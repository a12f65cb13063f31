package com.koni.glucose.application.query;

import com.koni.glucose.domain.exception.ValidationException;
import com.koni.glucose.domain.model.Credentials;
import com.koni.glucose.domain.model.DateRange;
import com.koni.glucose.domain.service.ReadingExtractor;
import lombok.Getter;

/**
 * Query to build a glucose report for one user.
 * Holds the user's credentials, the optional date bounds and the requested
 * measurement type (only {@code smbg} is supported).
 */
@Getter
public class GenerateGlucoseReportQuery {

    private final Credentials credentials;
    private final DateRange dateRange;
    private final String dataType;

    /**
     * @param credentials the user's login
     * @param dateRange the date bounds, {@code null} for none
     * @param dataType the requested type, blank for the default {@code smbg}
     */
    public GenerateGlucoseReportQuery(Credentials credentials, DateRange dateRange, String dataType) {
        this.credentials = credentials;
        this.dateRange = dateRange != null ? dateRange : DateRange.unbounded();
        this.dataType = dataType == null || dataType.isBlank() ? ReadingExtractor.SUPPORTED_TYPE : dataType.trim();
    }

    /**
     * @throws ValidationException if credentials are missing or the data type is not supported
     */
    public void validate() {
        if (credentials == null) {
            throw new ValidationException("credentials are required");
        }
        credentials.validate();
        if (!ReadingExtractor.SUPPORTED_TYPE.equals(dataType)) {
            throw new ValidationException("Unsupported datatype '" + dataType + "': only "
                    + ReadingExtractor.SUPPORTED_TYPE + " is supported");
        }
    }
}
