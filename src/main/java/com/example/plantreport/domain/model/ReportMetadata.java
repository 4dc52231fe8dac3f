package com.example.plantreport.domain.model;

import java.time.Instant;

/**
 * Descriptive fields written into the PDF info dictionary and XMP packet.
 * {@code createdAt} is the only time-dependent value in a rendered report.
 */
public record ReportMetadata(String title, String creator, Instant createdAt) {
}
