package com.example.plantreport.domain.model;

/**
 * Where an image ends up: the page index plus its draw rectangle (lower-left corner, width, height).
 */
public record ImagePlacement(
        int pageIndex,
        float x,
        float y,
        float width,
        float height
) {

    public ImageDraw toDrawCommand(DecodedImage image) {
        return new ImageDraw(x, y, width, height, image);
    }
}
