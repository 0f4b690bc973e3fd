package com.example.certify.domain.exception;

/**
 * Raised when no course record survived section gating, e.g. the graduate record marker never appeared.
 */
public class EmptyLedgerException extends UnusableTranscriptException {

    public EmptyLedgerException(String source) {
        super("No usable graduate course records found in: ", source);
    }
}
