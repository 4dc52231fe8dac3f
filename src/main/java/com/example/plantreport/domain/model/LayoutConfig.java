package com.example.plantreport.domain.model;

/**
 * Page geometry and body typography for one report.
 * All values are PDF points with the origin in the bottom-left corner, so {@code topMargin} is the
 * baseline of the first line on a page and {@code bottomMargin} the lowest y any content may reach.
 *
 * @param pageWidth    page width
 * @param pageHeight   page height
 * @param leftMargin   x of the text column and of images
 * @param topMargin    y where each page starts placing content
 * @param bottomMargin y below which nothing is placed
 * @param maxLineWidth width of the text column, also the widest an image may be drawn
 * @param fontSize     body font size
 * @param lineHeight   body line advance
 * @param imageGap     space left between the last text line and an image on the same page
 */
public record LayoutConfig(
        float pageWidth,
        float pageHeight,
        float leftMargin,
        float topMargin,
        float bottomMargin,
        float maxLineWidth,
        float fontSize,
        float lineHeight,
        float imageGap
) {

    public static final float A4_WIDTH = 595.28f;
    public static final float A4_HEIGHT = 841.89f;

    public LayoutConfig {
        if (pageWidth <= 0f || pageHeight <= 0f) {
            throw new IllegalArgumentException("Page size must be positive.");
        }
        if (leftMargin < 0f || maxLineWidth <= 0f || leftMargin + maxLineWidth > pageWidth) {
            throw new IllegalArgumentException("Text column must fit inside the page width.");
        }
        if (bottomMargin < 0f || topMargin > pageHeight || topMargin - bottomMargin < lineHeight) {
            throw new IllegalArgumentException("Top and bottom margins must leave room for at least one line.");
        }
        if (fontSize <= 0f || lineHeight <= 0f || imageGap < 0f) {
            throw new IllegalArgumentException("Font size and line height must be positive, image gap non-negative.");
        }
    }

	/**
	 * @return layout matching the A4 report the service produces by default
	 */
    public static LayoutConfig a4() {
        return new LayoutConfig(A4_WIDTH, A4_HEIGHT, 50f, 800f, 50f, 500f, 12f, 18f, 20f);
    }

    public float usableHeight() {
        return topMargin - bottomMargin;
    }

    public TextStyle bodyStyle() {
        return new TextStyle(fontSize, lineHeight, RgbColor.BLACK, TextAlignment.LEFT);
    }
}
