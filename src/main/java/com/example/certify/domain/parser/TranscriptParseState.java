package com.example.certify.domain.parser;

import com.example.certify.domain.model.CourseRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Mutable per-transcript parsing context. Never shared between transcripts.
 */
public final class TranscriptParseState {

    private TranscriptSection section = TranscriptSection.PRE_RECORD;
    private String semester = "";
    private SpecialTopicsBuffer buffer = SpecialTopicsBuffer.empty();
    private final List<CourseRecord> records = new ArrayList<>();
    private boolean finished;

    public TranscriptSection section() {
        return section;
    }

    public String semester() {
        return semester;
    }

    public SpecialTopicsBuffer buffer() {
        return buffer;
    }

    /**
     * Moves to a later section. The pending buffer is flushed so a record never spans two sections.
     *
     * @param next target section
     * @throws IllegalStateException when {@code next} would move backwards
     */
    void enter(TranscriptSection next) {
        if (next.ordinal() < section.ordinal()) {
            throw new IllegalStateException("Cannot move from " + section + " back to " + next);
        }
        flushBuffer();
        section = next;
    }

    void startSemester(String semesterCode) {
        flushBuffer();
        semester = semesterCode;
    }

    void append(CourseRecord record) {
        checkOpen();
        records.add(record);
    }

    void hold(CourseRecord record) {
        flushBuffer();
        buffer = SpecialTopicsBuffer.holding(record);
    }

    /**
     * Finalizes the buffered record after applying {@code refinement}; no-op when nothing is held.
     *
     * @return {@code true} when a buffered record was refined
     */
    boolean refineBuffered(UnaryOperator<CourseRecord> refinement) {
        if (!(buffer instanceof SpecialTopicsBuffer.Holding holding)) {
            return false;
        }
        buffer = SpecialTopicsBuffer.empty();
        append(refinement.apply(holding.record()));
        return true;
    }

    void flushBuffer() {
        if (buffer instanceof SpecialTopicsBuffer.Holding holding) {
            buffer = SpecialTopicsBuffer.empty();
            append(holding.record());
        }
    }

    /**
     * Flushes any pending record and hands over the ledger. The state cannot be used afterwards.
     *
     * @return immutable records in document order
     */
    List<CourseRecord> finish() {
        flushBuffer();
        finished = true;
        return List.copyOf(records);
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException("Parse state already finished");
        }
    }
}
