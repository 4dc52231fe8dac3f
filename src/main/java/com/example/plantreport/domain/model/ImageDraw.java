package com.example.plantreport.domain.model;

/**
 * An image drawn into the rectangle whose lower-left corner is {@code (x, y)}.
 */
public record ImageDraw(
        float x,
        float y,
        float width,
        float height,
        DecodedImage image
) implements DrawCommand {
}
