package com.example.plantreport.infrastructure.pdf;

import com.example.plantreport.infrastructure.exception.RenderException;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.util.Locale;

/**
 * Resolves configured family names such as {@code HELVETICA} or {@code Times-Roman} to PDFBox standard 14 fonts.
 */
final class StandardFonts {

    private StandardFonts() {
    }

	/**
	 * @param family family name, matched case-insensitively with {@code -} and {@code _} interchangeable
	 * @return a new font instance owned by the caller
	 * @throws RenderException when the name is not one of the standard 14 fonts
	 */
    static PDType1Font load(String family) {
        if (family == null || family.isBlank()) {
            throw new RenderException("No font family configured.");
        }
        String constant = family.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return new PDType1Font(Standard14Fonts.FontName.valueOf(constant));
        } catch (IllegalArgumentException ex) {
            throw new RenderException("Unknown standard font family: " + family, ex);
        }
    }
}
