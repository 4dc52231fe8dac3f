package com.example.plantreport.infrastructure.pdf;

import com.example.plantreport.domain.layout.FontMetrics;
import com.example.plantreport.infrastructure.exception.RenderException;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link FontMetrics} backed by the same PDFBox font the writer embeds.
 * Characters outside the font's encoding are replaced with {@code ?}, since standard 14 fonts only cover WinAnsi.
 * Not thread-safe; create one per report.
 */
public class PdfBoxFontMetrics implements FontMetrics {

    private static final String REPLACEMENT = "?";

    private final PDFont font;
    private final Map<Integer, Boolean> encodable = new HashMap<>();

    public PdfBoxFontMetrics(PDFont font) {
        this.font = font;
    }

    public static PdfBoxFontMetrics forFamily(String family) {
        return new PdfBoxFontMetrics(StandardFonts.load(family));
    }

    @Override
    public float advanceWidth(String text, float fontSize) {
        try {
            return font.getStringWidth(text) / 1000f * fontSize;
        } catch (IOException | IllegalArgumentException ex) {
            throw new RenderException("Unable to measure text with font " + font.getName(), ex);
        }
    }

    @Override
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder drawable = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            if (encodable.computeIfAbsent(codePoint, this::canEncode)) {
                drawable.appendCodePoint(codePoint);
            } else {
                drawable.append(REPLACEMENT);
            }
        });
        return drawable.toString();
    }

    private boolean canEncode(int codePoint) {
        if (Character.isISOControl(codePoint)) {
            return false;
        }
        try {
            font.encode(new String(Character.toChars(codePoint)));
            return true;
        } catch (IllegalArgumentException ex) {
            // PDFBox signals a missing glyph in the font's encoding this way
            return false;
        } catch (IOException ex) {
            throw new RenderException("Unable to read glyph data from font " + font.getName(), ex);
        }
    }
}
