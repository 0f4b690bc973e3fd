package com.example.certify.domain.exception;

/**
 * Raised when the student name or number is missing after every page was scanned.
 * The transcript is skipped; this does not count as a certification failure.
 */
public class IdentityNotFoundException extends UnusableTranscriptException {

    public IdentityNotFoundException(String source) {
        super("Could not extract student name or ID from: ", source);
    }
}
