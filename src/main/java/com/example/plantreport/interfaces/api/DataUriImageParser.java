package com.example.plantreport.interfaces.api;

import com.example.plantreport.domain.exception.ImageDecodeException;
import com.example.plantreport.domain.exception.UnsupportedImageFormatException;
import com.example.plantreport.domain.model.ImageAttachment;

import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code data:<mime>[;key=value]*;base64,<payload>} strings sent by the browser into an
 * {@link ImageAttachment}. The mime type and its parameters are passed on untouched; deciding whether it
 * is supported belongs to the application layer.
 */
public final class DataUriImageParser {

    private static final Pattern DATA_URI = Pattern.compile("^data:([^;,]+(?:;[^;,=]+=[^;,]*)*);base64,(.*)$", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DataUriImageParser() {
    }

	/**
	 * @param dataUri data URI from the request body, blank means no image
	 * @return parsed attachment or {@code null} when no image was sent
	 * @throws UnsupportedImageFormatException when the value is not a base64 data URI
	 * @throws ImageDecodeException            when the base64 payload is malformed
	 */
    public static ImageAttachment parse(String dataUri) {
        if (dataUri == null || dataUri.isBlank()) {
            return null;
        }
        Matcher matcher = DATA_URI.matcher(dataUri.trim());
        if (!matcher.matches()) {
            throw new UnsupportedImageFormatException(null);
        }
        String payload = WHITESPACE.matcher(matcher.group(2)).replaceAll("");
        try {
            return new ImageAttachment(Base64.getDecoder().decode(payload), matcher.group(1));
        } catch (IllegalArgumentException ex) {
            throw new ImageDecodeException("The image data is not valid base64.", ex);
        }
    }
}
