package com.example.certify.domain.parser;

import java.math.BigDecimal;

/**
 * Structured event emitted by {@link TranscriptLineClassifier} for a single accepted line.
 */
public sealed interface TranscriptLineEvent {

    /**
     * A section marker moved the parser forward.
     */
    record SectionChange(TranscriptSection target) implements TranscriptLineEvent {
    }

    /**
     * A "YYYY Fall|Spring" header; {@code semesterCode} is already normalized, e.g. {@code F23}.
     */
    record SemesterHeader(String semesterCode) implements TranscriptLineEvent {
    }

    record CourseLine(
            String code,
            String title,
            BigDecimal attemptedCredits,
            BigDecimal earnedCredits,
            String grade,
            BigDecimal qualityPoints
    ) implements TranscriptLineEvent {
    }

    record TopicLine(String topic) implements TranscriptLineEvent {
    }
}
