package com.example.plantreport.domain.model;

/**
 * Fill colour for text, each channel in {@code [0, 1]}.
 */
public record RgbColor(float red, float green, float blue) {

    public static final RgbColor BLACK = new RgbColor(0f, 0f, 0f);

    public RgbColor {
        if (!inRange(red) || !inRange(green) || !inRange(blue)) {
            throw new IllegalArgumentException("Colour channels must lie in [0, 1].");
        }
    }

    private static boolean inRange(float channel) {
        return channel >= 0f && channel <= 1f;
    }
}
