package com.example.plantreport.domain.model;

/**
 * Raw image as received at the boundary: undecoded bytes plus the mime type the client declared.
 */
public record ImageAttachment(byte[] bytes, String mimeType) {
}
