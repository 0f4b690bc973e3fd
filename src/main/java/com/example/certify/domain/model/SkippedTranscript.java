package com.example.certify.domain.model;

/**
 * Diagnostic for a transcript that could not be certified (unreadable, no identity, or no usable records).
 */
public record SkippedTranscript(String source, String reason) {
}
