package com.example.plantreport.domain.layout;

import com.example.plantreport.domain.exception.ImageTooTallException;
import com.example.plantreport.domain.exception.InvalidImageScaleException;
import com.example.plantreport.domain.model.ImagePlacement;
import com.example.plantreport.domain.model.LayoutConfig;
import com.example.plantreport.domain.model.LayoutCursor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for image placement after the text flow.
 */
class ImagePlacementResolverTest {

    private static final LayoutConfig CONFIG = new LayoutConfig(200f, 300f, 10f, 250f, 50f, 100f, 10f, 20f, 10f);

    private final ImagePlacementResolver resolver = new ImagePlacementResolver(CONFIG);

    @Test
    void placesBelowTextWhenItFits() {
        ImagePlacement placement = resolver.place(100, 100, 0.5d, new LayoutCursor(0, 200f));

        assertThat(placement).isEqualTo(new ImagePlacement(0, 10f, 140f, 50f, 50f));
    }

    @Test
    void movesToNextPageWhenTextEndsJustAboveBottomMargin() {
        LayoutCursor cursor = new LayoutCursor(2, CONFIG.bottomMargin() + 1f);

        ImagePlacement placement = resolver.place(10, 10, 1d, cursor);

        assertThat(placement.pageIndex()).isEqualTo(3);
        assertThat(placement.y()).isEqualTo(240f);
        assertThat(placement.height()).isEqualTo(10f);
    }

    @Test
    void gapIsPartOfTheFitCheck() {
        ImagePlacement placement = resolver.place(40, 40, 1d, new LayoutCursor(0, 95f));

        assertThat(placement.pageIndex()).isEqualTo(1);
        assertThat(placement.y()).isGreaterThanOrEqualTo(CONFIG.bottomMargin());
    }

    @Test
    void usesCurrentPageWhenCursorIsAtItsTop() {
        ImagePlacement placement = resolver.place(100, 400, 0.5d, LayoutCursor.start(CONFIG));

        assertThat(placement).isEqualTo(new ImagePlacement(0, 10f, 50f, 50f, 200f));
    }

    @Test
    void rejectsImageTallerThanAnEmptyPage() {
        ImageTooTallException ex = assertThrows(ImageTooTallException.class,
                () -> resolver.place(100, 500, 0.5d, LayoutCursor.start(CONFIG)));

        assertThat(ex.scaledHeight()).isEqualTo(250f);
        assertThat(ex.usableHeight()).isEqualTo(200f);
    }

    @Test
    void shrinksImageWiderThanColumnKeepingAspectRatio() {
        ImagePlacement placement = resolver.place(400, 100, 0.5d, new LayoutCursor(0, 200f));

        assertThat(placement.width()).isEqualTo(100f);
        assertThat(placement.height()).isEqualTo(25f);
        assertThat(placement.x()).isEqualTo(CONFIG.leftMargin());
    }

    @Test
    void rejectsNonPositiveOrNonFiniteScale() {
        LayoutCursor cursor = LayoutCursor.start(CONFIG);

        assertThrows(InvalidImageScaleException.class, () -> resolver.place(10, 10, 0d, cursor));
        assertThrows(InvalidImageScaleException.class, () -> resolver.place(10, 10, -1d, cursor));
        assertThrows(InvalidImageScaleException.class, () -> resolver.place(10, 10, Double.NaN, cursor));
        assertThrows(InvalidImageScaleException.class, () -> resolver.place(10, 10, Double.POSITIVE_INFINITY, cursor));
    }
}
