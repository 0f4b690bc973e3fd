package com.example.certify.domain.exception;

/**
 * A transcript that could be read but not certified. Carries the transcript's logical name
 * so batch diagnostics and API errors can point at it.
 */
public abstract class UnusableTranscriptException extends DomainException {

    private final String source;

    protected UnusableTranscriptException(String message, String source) {
        super(message + source);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
