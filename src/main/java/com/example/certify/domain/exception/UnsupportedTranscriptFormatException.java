package com.example.certify.domain.exception;

/**
 * Raised when an uploaded file does not look like a PDF transcript.
 */
public class UnsupportedTranscriptFormatException extends DomainException {

	/**
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedTranscriptFormatException(String fileName) {
        super("Only PDF transcripts are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
