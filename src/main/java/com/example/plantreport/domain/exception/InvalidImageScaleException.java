package com.example.plantreport.domain.exception;

/**
 * Raised when the requested image scale factor is zero, negative or not a finite number.
 */
public class InvalidImageScaleException extends DomainException {

    public InvalidImageScaleException(double scale) {
        super("Image scale must be a positive number but was " + scale + ".");
    }
}
