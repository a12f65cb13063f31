package com.koni.glucose.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Form fields of the report options page.
 *
 * Contains:
 * - useremail: Tidepool login (required)
 * - password: Tidepool password (required)
 * - startdate / enddate: optional bounds, yyyy-MM-dd
 * - datatype: measurement type, smbg when blank
 *
 * Field names match the HTML form, so they are bound as-is from
 * application/x-www-form-urlencoded requests. Required fields are validated
 * using Jakarta Bean Validation annotations.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class GlucoseReportRequest {

    @NotBlank(message = "useremail is required")
    private String useremail;

    @NotBlank(message = "password is required")
    private String password;

    private String startdate;
    private String enddate;
    private String datatype;

    @Override
    public String toString() {
        return "GlucoseReportRequest{useremail=" + useremail
                + ", startdate=" + startdate
                + ", enddate=" + enddate
                + ", datatype=" + datatype + "}";
    }
}
