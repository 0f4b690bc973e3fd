package com.example.certify.domain.exception;

/**
 * Raised when a referenced transcript does not exist on disk.
 */
public class TranscriptNotFoundException extends DomainException {

	/**
	 * @param path absolute or relative path that could not be resolved
	 */
    public TranscriptNotFoundException(String path) {
        super("Transcript not found: " + path);
    }
}
