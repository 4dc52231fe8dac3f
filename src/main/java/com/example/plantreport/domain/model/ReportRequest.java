package com.example.plantreport.domain.model;

/**
 * Everything the report engine needs for one document.
 *
 * @param text  analysis text produced upstream, may be blank
 * @param image optional image to append after the text
 * @param scale image scale factor, {@code null} for the configured default
 */
public record ReportRequest(String text, ImageAttachment image, Double scale) {

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasImage() {
        return image != null;
    }
}
