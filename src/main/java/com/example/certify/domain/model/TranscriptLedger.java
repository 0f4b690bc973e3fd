package com.example.certify.domain.model;

import java.util.List;

/**
 * Ordered course records of one transcript (document order) together with the student identity.
 */
public record TranscriptLedger(StudentIdentity identity, List<CourseRecord> records) {

    public TranscriptLedger {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
