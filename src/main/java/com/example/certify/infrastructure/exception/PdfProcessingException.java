package com.example.certify.infrastructure.exception;

/**
 * Signals that the text of a transcript PDF could not be extracted.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
