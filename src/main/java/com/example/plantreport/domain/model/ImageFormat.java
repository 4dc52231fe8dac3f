package com.example.plantreport.domain.model;

import com.example.plantreport.domain.exception.UnsupportedImageFormatException;

import java.util.Locale;

/**
 * Domain enumeration of the image encodings a report can embed.
 * The format is always taken from the mime type supplied with the bytes, never sniffed from content.
 */
public enum ImageFormat {
    JPEG("image/jpeg", "jpeg"),
    PNG("image/png", "png");

    private final String mimeType;
    private final String readerFormatName;

    ImageFormat(String mimeType, String readerFormatName) {
        this.mimeType = mimeType;
        this.readerFormatName = readerFormatName;
    }

    public String mimeType() {
        return mimeType;
    }

	/**
	 * @return format name understood by {@code javax.imageio.ImageIO} reader lookups
	 */
    public String readerFormatName() {
        return readerFormatName;
    }

	/**
	 * Parses a mime type tag into a supported format.
	 * Parameters such as {@code ;charset=...} are ignored and the comparison is case-insensitive.
	 *
	 * @param rawMimeType mime type coming from the request boundary
	 * @return matching format
	 * @throws UnsupportedImageFormatException when the tag is missing or names anything but JPEG/PNG
	 */
    public static ImageFormat fromMimeType(String rawMimeType) {
        if (rawMimeType == null || rawMimeType.isBlank()) {
            throw new UnsupportedImageFormatException(null);
        }
        String normalized = rawMimeType.trim().toLowerCase(Locale.ROOT);
        int parameterStart = normalized.indexOf(';');
        if (parameterStart >= 0) {
            normalized = normalized.substring(0, parameterStart).trim();
        }
        for (ImageFormat format : values()) {
            if (format.mimeType.equals(normalized)) {
                return format;
            }
        }
        throw new UnsupportedImageFormatException(rawMimeType);
    }
}
