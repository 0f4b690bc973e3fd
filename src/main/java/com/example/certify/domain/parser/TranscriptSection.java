package com.example.certify.domain.parser;

/**
 * Logical region of a transcript. Transitions only move forward; {@link #GRADUATE_RECORD} is terminal.
 */
public enum TranscriptSection {
    PRE_RECORD,
    TRANSFER_SECTION,
    GRADUATE_RECORD;

    /**
     * Computes the state reached after reading {@code line}.
     *
     * @param line    raw text line
     * @param markers section marker tokens
     * @return next state, {@code this} when the line is not a marker valid here
     */
    public TranscriptSection advance(String line, TranscriptMarkers markers) {
        if (line == null) {
            return this;
        }
        return switch (this) {
            case PRE_RECORD -> {
                if (line.contains(markers.graduateMarker())) {
                    yield GRADUATE_RECORD;
                }
                yield line.contains(markers.transferMarker()) ? TRANSFER_SECTION : PRE_RECORD;
            }
            case TRANSFER_SECTION -> line.contains(markers.graduateMarker()) ? GRADUATE_RECORD : TRANSFER_SECTION;
            case GRADUATE_RECORD -> GRADUATE_RECORD;
        };
    }

    boolean acceptsCourses() {
        return this != PRE_RECORD;
    }

    boolean acceptsSemesterHeaders() {
        return this == GRADUATE_RECORD;
    }

    boolean acceptsTopics() {
        return this == GRADUATE_RECORD;
    }

    boolean isTransfer() {
        return this == TRANSFER_SECTION;
    }
}
