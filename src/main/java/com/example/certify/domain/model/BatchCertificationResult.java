package com.example.certify.domain.model;

import java.util.List;

/**
 * Outcome of a batch: every certified transcript in input order plus diagnostics for the skipped ones.
 */
public record BatchCertificationResult(
        List<TranscriptCertification> certified,
        List<SkippedTranscript> skipped
) {

    public BatchCertificationResult {
        certified = certified == null ? List.of() : List.copyOf(certified);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }
}
