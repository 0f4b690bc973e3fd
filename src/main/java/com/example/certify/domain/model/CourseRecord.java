package com.example.certify.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Domain DTO describing one finalized course entry of a transcript ledger.
 * Instances are immutable; title refinements produce a copy through {@link #withTitle(String)}.
 */
public record CourseRecord(
        String semester,
        String code,
        String title,
        BigDecimal attemptedCredits,
        BigDecimal creditsEarned,
        String grade,
        BigDecimal qualityPoints,
        boolean transferCredit,
        Classification classification
) {

    public CourseRecord {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Course code is required.");
        }
        Objects.requireNonNull(creditsEarned, "creditsEarned");
        if (creditsEarned.signum() < 0) {
            throw new IllegalArgumentException("Earned credits must not be negative: " + code);
        }
        Objects.requireNonNull(classification, "classification");
        semester = semester == null ? "" : semester;
        title = title == null ? "" : title;
        grade = grade == null ? "" : grade;
        attemptedCredits = attemptedCredits == null ? BigDecimal.ZERO : attemptedCredits;
        qualityPoints = qualityPoints == null || transferCredit ? BigDecimal.ZERO : qualityPoints;
    }

    /**
     * Returns a copy carrying a different title.
     *
     * @param newTitle replacement title
     * @return copy of this record
     */
    public CourseRecord withTitle(String newTitle) {
        return new CourseRecord(semester, code, newTitle, attemptedCredits, creditsEarned, grade,
                qualityPoints, transferCredit, classification);
    }

    /**
     * @return department prefix, e.g. {@code PHY} for {@code PHY 543}
     */
    public String department() {
        int space = code.indexOf(' ');
        return space < 0 ? code : code.substring(0, space);
    }
}
