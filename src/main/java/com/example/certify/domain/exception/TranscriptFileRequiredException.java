package com.example.certify.domain.exception;

/**
 * Raised when a certification request arrives without any transcript PDF.
 */
public class TranscriptFileRequiredException extends DomainException {

    public TranscriptFileRequiredException() {
        super("Please choose at least one transcript PDF to certify.");
    }
}
