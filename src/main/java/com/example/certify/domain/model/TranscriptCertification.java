package com.example.certify.domain.model;

/**
 * Ledger and evaluation of one successfully processed transcript.
 */
public record TranscriptCertification(
        String source,
        TranscriptLedger ledger,
        CertificationResult result
) {

    public StudentIdentity identity() {
        return ledger.identity();
    }
}
