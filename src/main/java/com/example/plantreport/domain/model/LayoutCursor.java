package com.example.plantreport.domain.model;

/**
 * Running position threaded through planning: which page is being filled and where the next baseline goes.
 */
public record LayoutCursor(int pageIndex, float y) {

    public LayoutCursor {
        if (pageIndex < 0) {
            throw new IllegalArgumentException("Page index must not be negative.");
        }
        if (y < 0f) {
            throw new IllegalArgumentException("Cursor y must not be negative.");
        }
    }

    public static LayoutCursor start(LayoutConfig config) {
        return new LayoutCursor(0, config.topMargin());
    }

	/**
	 * @param config page geometry
	 * @return vertical space left between the cursor and the bottom margin
	 */
    public float remainingSpace(LayoutConfig config) {
        return y - config.bottomMargin();
    }

    public boolean fits(float lineHeight, LayoutConfig config) {
        return remainingSpace(config) >= lineHeight;
    }

    public boolean atPageStart(LayoutConfig config) {
        return y >= config.topMargin();
    }

    public LayoutCursor advance(float lineHeight) {
        return new LayoutCursor(pageIndex, y - lineHeight);
    }

    public LayoutCursor nextPage(LayoutConfig config) {
        return new LayoutCursor(pageIndex + 1, config.topMargin());
    }
}
