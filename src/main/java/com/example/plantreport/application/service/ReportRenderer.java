package com.example.plantreport.application.service;

import com.example.plantreport.application.port.DocumentWriter;
import com.example.plantreport.application.port.DocumentWriter.FontHandle;
import com.example.plantreport.application.port.DocumentWriter.ImageHandle;
import com.example.plantreport.application.port.DocumentWriter.PageHandle;
import com.example.plantreport.domain.model.DecodedImage;
import com.example.plantreport.domain.model.DocumentLayout;
import com.example.plantreport.domain.model.DrawCommand;
import com.example.plantreport.domain.model.ImageDraw;
import com.example.plantreport.domain.model.PageLayout;
import com.example.plantreport.domain.model.ReportMetadata;
import com.example.plantreport.domain.model.TextLine;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Replays a planned {@link DocumentLayout} against a {@link DocumentWriter} and serializes the result.
 * <p>
 * A renderer moves through {@code EMPTY -> BUILDING -> SERIALIZED} exactly once. Any failure leaves it in
 * {@code BUILDING}, and a new report always needs a new renderer with a new writer. The writer is closed
 * when rendering ends, successfully or not.
 */
public class ReportRenderer {

    public enum State {
        EMPTY,
        BUILDING,
        SERIALIZED
    }

    private final DocumentWriter writer;
    private State state = State.EMPTY;

    public ReportRenderer(DocumentWriter writer) {
        this.writer = writer;
    }

	/**
	 * Issues one writer call per planned command, page by page, then serializes.
	 *
	 * @param layout   planned document
	 * @param metadata descriptive fields for the document
	 * @return serialized document
	 * @throws IllegalStateException when this renderer was already used
	 */
    public byte[] render(DocumentLayout layout, ReportMetadata metadata) {
        if (state != State.EMPTY) {
            throw new IllegalStateException("Renderer is " + state + "; each report needs a new renderer.");
        }
        state = State.BUILDING;

        try (DocumentWriter target = writer) {
            FontHandle font = null;
            Map<DecodedImage, ImageHandle> embeddedImages = new IdentityHashMap<>();
            for (PageLayout page : layout.pages()) {
                PageHandle pageHandle = target.addPage(layout.pageWidth(), layout.pageHeight());
                for (DrawCommand command : page.commands()) {
                    if (command instanceof TextLine line) {
                        if (font == null) {
                            font = target.embedFont(layout.fontFamily());
                        }
                        target.drawText(pageHandle, font, line.x(), line.y(), line.fontSize(), line.color(), line.content());
                    } else if (command instanceof ImageDraw image) {
                        ImageHandle handle = embeddedImages.computeIfAbsent(image.image(),
                                decoded -> target.embedImage(decoded.bytes(), decoded.format()));
                        target.drawImage(pageHandle, handle, image.x(), image.y(), image.width(), image.height());
                    } else {
                        throw new IllegalArgumentException("Unknown draw command: " + command.getClass().getName());
                    }
                }
            }
            target.describe(metadata);
            byte[] bytes = target.save();
            state = State.SERIALIZED;
            return bytes;
        }
    }

    public State state() {
        return state;
    }
}
