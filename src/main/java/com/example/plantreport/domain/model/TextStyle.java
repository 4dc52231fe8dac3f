package com.example.plantreport.domain.model;

/**
 * Typographic settings applied to a block of planned text.
 *
 * @param fontSize   font size in points
 * @param lineHeight vertical advance between consecutive baselines
 * @param color      fill colour
 * @param alignment  horizontal placement inside the text column
 */
public record TextStyle(
        float fontSize,
        float lineHeight,
        RgbColor color,
        TextAlignment alignment
) {

    public TextStyle {
        if (fontSize <= 0f || lineHeight <= 0f) {
            throw new IllegalArgumentException("Font size and line height must be positive.");
        }
        if (color == null) {
            color = RgbColor.BLACK;
        }
        if (alignment == null) {
            alignment = TextAlignment.LEFT;
        }
    }
}
