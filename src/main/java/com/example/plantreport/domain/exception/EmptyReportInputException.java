package com.example.plantreport.domain.exception;

/**
 * Raised when a report is requested with neither analysis text nor an image.
 * Guards the renderer from producing a document with nothing in it.
 */
public class EmptyReportInputException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public EmptyReportInputException() {
        super("Nothing to render: provide analysis text, an image, or both.");
    }
}
