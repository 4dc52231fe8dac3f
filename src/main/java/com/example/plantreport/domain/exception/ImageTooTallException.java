package com.example.plantreport.domain.exception;

import java.util.Locale;

/**
 * Raised when a scaled image is taller than the usable height of an empty page.
 * The caller is expected to retry with a smaller scale factor.
 */
public class ImageTooTallException extends DomainException {

    private final float scaledHeight;
    private final float usableHeight;

	/**
	 * Creates the exception describing how far the image overshoots the page.
	 *
	 * @param scaledHeight image height in points after scaling
	 * @param usableHeight vertical space between the top and bottom margins
	 */
    public ImageTooTallException(float scaledHeight, float usableHeight) {
        super(String.format(Locale.ROOT,
                "Image is %.1fpt tall after scaling but a page only has %.1fpt available. Reduce the scale.",
                scaledHeight, usableHeight));
        this.scaledHeight = scaledHeight;
        this.usableHeight = usableHeight;
    }

    public float scaledHeight() {
        return scaledHeight;
    }

    public float usableHeight() {
        return usableHeight;
    }
}
