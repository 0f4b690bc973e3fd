package com.example.certify.domain.exception;

/**
 * Raised when a caller attempts to certify a null {@link java.nio.file.Path}.
 */
public class TranscriptPathRequiredException extends DomainException {

    public TranscriptPathRequiredException() {
        super("Transcript path is required.");
    }
}
