package com.example.plantreport.domain.exception;

/**
 * Raised when an image payload cannot be decoded as the format it was declared as.
 */
public class ImageDecodeException extends DomainException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
