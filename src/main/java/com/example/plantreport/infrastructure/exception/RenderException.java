package com.example.plantreport.infrastructure.exception;

/**
 * Infrastructure-layer exception raised when the document writer cannot build or serialize the PDF.
 * Aborts the whole report; no partial document is kept.
 */
public class RenderException extends InfrastructureException {

    public RenderException(String message) {
        super(message);
    }

	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox or ImageIO exception
	 */
    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
