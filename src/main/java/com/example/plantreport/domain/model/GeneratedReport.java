package com.example.plantreport.domain.model;

/**
 * Serialized report ready to be stored and handed to the caller.
 */
public record GeneratedReport(String fileName, byte[] content, int pageCount) {
}
