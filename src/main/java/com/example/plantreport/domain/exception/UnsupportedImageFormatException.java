package com.example.plantreport.domain.exception;

/**
 * Raised when an image is tagged with a mime type other than JPEG or PNG, or carries no usable tag at all.
 * Thrown before any decode attempt so the document writer never sees the payload.
 */
public class UnsupportedImageFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending mime type so the user can react.
	 *
	 * @param mimeType mime type supplied with the image, may be {@code null}
	 */
    public UnsupportedImageFormatException(String mimeType) {
        super("Unsupported image format" + (mimeType != null ? ": " + mimeType : "")
                + ". Please upload a JPEG or PNG image.");
    }
}
