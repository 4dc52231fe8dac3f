package com.example.plantreport.application.port;

import com.example.plantreport.domain.model.ImageFormat;
import com.example.plantreport.domain.model.ReportMetadata;
import com.example.plantreport.domain.model.RgbColor;

/**
 * Low-level document writer driven by the renderer. One instance owns exactly one document.
 * Implementations report failures as unchecked {@code RenderException}s.
 */
public interface DocumentWriter extends AutoCloseable {

    PageHandle addPage(float width, float height);

    FontHandle embedFont(String family);

    void drawText(PageHandle page, FontHandle font, float x, float y, float size, RgbColor color, String text);

    ImageHandle embedImage(byte[] bytes, ImageFormat format);

    void drawImage(PageHandle page, ImageHandle image, float x, float y, float width, float height);

	/**
	 * Sets the descriptive metadata written on {@link #save()}.
	 *
	 * @param metadata title, creator and creation time
	 */
    void describe(ReportMetadata metadata);

	/**
	 * Serializes the whole document.
	 *
	 * @return document bytes
	 */
    byte[] save();

	/**
	 * Releases the document; never throws.
	 */
    @Override
    void close();

    record PageHandle(int index) {
    }

    record FontHandle(int index, String family) {
    }

    record ImageHandle(int index) {
    }
}
