package com.example.plantreport.domain.model;

/**
 * A single wrapped line of text, {@code y} being its baseline.
 */
public record TextLine(
        float x,
        float y,
        String content,
        float fontSize,
        RgbColor color
) implements DrawCommand {
}
