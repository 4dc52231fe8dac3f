package com.example.plantreport.interfaces.api;

import com.example.plantreport.domain.model.ReportRequest;

/**
 * API-layer DTO for report downloads, matching what the browser sends after an analysis.
 *
 * @param result analysis text
 * @param image  optional {@code data:} URI of the analysed photo
 * @param scale  optional image scale factor
 */
public record ReportDownloadRequest(String result, String image, Double scale) {

    public ReportRequest toReportRequest() {
        return new ReportRequest(result, DataUriImageParser.parse(image), scale);
    }
}
