package com.example.certify.application.exception;

/**
 * Thrown when a certification report cannot be built from the supplied data.
 */
public class ReportExportValidationException extends UseCaseValidationException {

    public ReportExportValidationException(String message) {
        super(message);
    }
}
