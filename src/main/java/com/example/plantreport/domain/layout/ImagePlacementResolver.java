package com.example.plantreport.domain.layout;

import com.example.plantreport.domain.exception.ImageTooTallException;
import com.example.plantreport.domain.exception.InvalidImageScaleException;
import com.example.plantreport.domain.model.LayoutConfig;
import com.example.plantreport.domain.model.LayoutCursor;
import com.example.plantreport.domain.model.ImagePlacement;

/**
 * Decides where an image goes once the text has been planned.
 * <p>
 * The image keeps its aspect ratio. It is scaled by the requested factor and shrunk further when it is
 * wider than the text column. It stays on the cursor's page when the image plus the gap above it fits
 * over the bottom margin, otherwise it opens the next page and is placed at the top.
 */
public class ImagePlacementResolver {

    private final LayoutConfig config;

    public ImagePlacementResolver(LayoutConfig config) {
        this.config = config;
    }

	/**
	 * Resolves the draw rectangle for an image.
	 *
	 * @param naturalWidth  image width in pixels
	 * @param naturalHeight image height in pixels
	 * @param scale         points per pixel
	 * @param cursor        position where the text ended
	 * @return target page and rectangle
	 * @throws InvalidImageScaleException when {@code scale} is not a positive finite number
	 * @throws ImageTooTallException      when the image cannot fit even on an empty page
	 */
    public ImagePlacement place(int naturalWidth, int naturalHeight, double scale, LayoutCursor cursor) {
        if (Double.isNaN(scale) || Double.isInfinite(scale) || scale <= 0d) {
            throw new InvalidImageScaleException(scale);
        }
        if (naturalWidth <= 0 || naturalHeight <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive.");
        }

        float width = (float) (naturalWidth * scale);
        float height = (float) (naturalHeight * scale);
        if (width > config.maxLineWidth()) {
            height = height * (config.maxLineWidth() / width);
            width = config.maxLineWidth();
        }
        if (height > config.usableHeight()) {
            throw new ImageTooTallException(height, config.usableHeight());
        }

        if (cursor.atPageStart(config)) {
            return new ImagePlacement(cursor.pageIndex(), config.leftMargin(), config.topMargin() - height, width, height);
        }
        if (height + config.imageGap() <= cursor.remainingSpace(config)) {
            return new ImagePlacement(cursor.pageIndex(), config.leftMargin(),
                    cursor.y() - height - config.imageGap(), width, height);
        }
        LayoutCursor fresh = cursor.nextPage(config);
        return new ImagePlacement(fresh.pageIndex(), config.leftMargin(), config.topMargin() - height, width, height);
    }
}
