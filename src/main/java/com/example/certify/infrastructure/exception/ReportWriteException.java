package com.example.certify.infrastructure.exception;

/**
 * Signals that a report or the summary CSV could not be written.
 */
public class ReportWriteException extends InfrastructureException {

    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
