package com.example.certify.domain.parser;

import java.util.Objects;

/**
 * Literal tokens that delimit transcript sections and continuation lines.
 *
 * @param transferMarker marker opening the transfer-credit section
 * @param graduateMarker marker opening the graduate record
 * @param topicMarker    marker of a special-topics continuation line
 */
public record TranscriptMarkers(String transferMarker, String graduateMarker, String topicMarker) {

    public TranscriptMarkers {
        Objects.requireNonNull(transferMarker, "transferMarker");
        Objects.requireNonNull(graduateMarker, "graduateMarker");
        Objects.requireNonNull(topicMarker, "topicMarker");
    }

    public static TranscriptMarkers defaults() {
        return new TranscriptMarkers("Transfer Credit", "Beginning of Graduate Record", "Course Topic:");
    }
}
