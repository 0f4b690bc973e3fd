package com.example.certify.domain.parser;

import com.example.certify.domain.model.Classification;
import com.example.certify.domain.model.CourseRecord;
import com.example.certify.domain.model.StudentIdentity;
import com.example.certify.domain.model.TranscriptLedger;
import com.example.certify.domain.policy.CourseClassifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Drives the section state machine and turns classified line events into finalized course records.
 */
public class TranscriptLedgerAssembler {

    private static final Logger log = LoggerFactory.getLogger(TranscriptLedgerAssembler.class);

    private final TranscriptLineClassifier lineClassifier;
    private final CourseClassifier courseClassifier;

    public TranscriptLedgerAssembler(TranscriptLineClassifier lineClassifier, CourseClassifier courseClassifier) {
        this.lineClassifier = lineClassifier;
        this.courseClassifier = courseClassifier;
    }

    /**
     * Parses the column lines of a whole transcript.
     *
     * @param identity identity extracted from page text
     * @param lines    every column line, pages in order, left column before right
     * @return ledger, empty when the graduate record marker never appeared
     */
    public TranscriptLedger assemble(StudentIdentity identity, List<String> lines) {
        TranscriptParseState state = new TranscriptParseState();
        for (String line : lines) {
            accept(state, line);
        }
        List<CourseRecord> records = state.finish();
        if (state.section() != TranscriptSection.GRADUATE_RECORD) {
            log.debug("Input ended in section {} without reaching the graduate record; discarding {} record(s)",
                    state.section(), records.size());
            return new TranscriptLedger(identity, List.of());
        }
        return new TranscriptLedger(identity, records);
    }

    /**
     * Applies one line to the state.
     *
     * @param state per-transcript state
     * @param line  raw text line
     */
    void accept(TranscriptParseState state, String line) {
        Optional<TranscriptLineEvent> event = lineClassifier.classify(line, state.section());
        if (event.isEmpty()) {
            return;
        }
        TranscriptLineEvent value = event.get();
        if (value instanceof TranscriptLineEvent.SectionChange change) {
            log.debug("Entering {}", change.target());
            state.enter(change.target());
        } else if (value instanceof TranscriptLineEvent.SemesterHeader header) {
            state.startSemester(header.semesterCode());
        } else if (value instanceof TranscriptLineEvent.CourseLine course) {
            acceptCourse(state, course);
        } else if (value instanceof TranscriptLineEvent.TopicLine topic) {
            boolean refined = state.refineBuffered(record ->
                    record.withTitle(courseClassifier.topicTitle(topic.topic(), record.transferCredit())));
            if (!refined) {
                log.debug("Ignoring topic line without a pending special-topics course: {}", line);
            }
        }
    }

    private void acceptCourse(TranscriptParseState state, TranscriptLineEvent.CourseLine course) {
        state.flushBuffer();

        boolean transfer = state.section().isTransfer() || courseClassifier.isTransferGrade(course.grade());
        Classification classification = courseClassifier.classify(course.code());
        CourseRecord record = new CourseRecord(
                state.semester(),
                course.code(),
                courseClassifier.initialTitle(course.title(), classification, transfer),
                course.attemptedCredits(),
                course.earnedCredits(),
                course.grade(),
                course.qualityPoints(),
                transfer,
                classification
        );

        if (courseClassifier.isSpecialTopics(course.code())) {
            state.hold(record);
        } else {
            state.append(record);
        }
    }
}
