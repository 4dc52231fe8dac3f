package com.example.plantreport.domain.model;

/**
 * Image whose declared format has been validated and whose natural size is known.
 * Produced by the infrastructure reader before any layout happens.
 */
public record DecodedImage(
        byte[] bytes,
        ImageFormat format,
        int pixelWidth,
        int pixelHeight
) {
}
