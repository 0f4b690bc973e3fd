package com.example.certify.domain.parser;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one transcript line against the patterns valid in the current section.
 * Lines matching nothing yield an empty result.
 */
public class TranscriptLineClassifier {

    private static final Pattern SEMESTER_PATTERN = Pattern.compile("^\\s*(\\d{4})\\s+(Fall|Spring|Sprng)");
    private static final String COURSE_PATTERN_TEMPLATE =
            "([A-Z]{3}\\s+\\d+)\\s+(.+?)\\s+(\\d\\.\\d{2})\\s+(\\d\\.\\d{2})\\s+([A-F][+-]?|%s)\\s+(\\d+\\.\\d{3})";
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TranscriptMarkers markers;
    private final Pattern coursePattern;

    /**
     * @param markers       section and continuation tokens
     * @param transferGrade grade token used for transfer credit, accepted next to letter grades
     */
    public TranscriptLineClassifier(TranscriptMarkers markers, String transferGrade) {
        this.markers = markers;
        this.coursePattern = Pattern.compile(String.format(COURSE_PATTERN_TEMPLATE, Pattern.quote(transferGrade)));
    }

    /**
     * Classifies a line. Section markers take precedence, then semester headers, course records
     * and continuation lines, each only where the section accepts it.
     *
     * @param line    raw text line
     * @param section section the parser is currently in
     * @return at most one event
     */
    public Optional<TranscriptLineEvent> classify(String line, TranscriptSection section) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        TranscriptSection next = section.advance(line, markers);
        if (next != section) {
            return Optional.of(new TranscriptLineEvent.SectionChange(next));
        }
        if (section.acceptsSemesterHeaders()) {
            Matcher semester = SEMESTER_PATTERN.matcher(line);
            if (semester.find()) {
                return Optional.of(new TranscriptLineEvent.SemesterHeader(semesterCode(semester.group(1), semester.group(2))));
            }
        }
        if (section.acceptsCourses()) {
            Matcher course = coursePattern.matcher(line);
            if (course.find()) {
                return Optional.of(toCourseLine(course));
            }
        }
        if (section.acceptsTopics()) {
            int markerIndex = line.lastIndexOf(markers.topicMarker());
            if (markerIndex >= 0) {
                String topic = line.substring(markerIndex + markers.topicMarker().length()).strip();
                return Optional.of(new TranscriptLineEvent.TopicLine(topic));
            }
        }
        return Optional.empty();
    }

    private TranscriptLineEvent.CourseLine toCourseLine(Matcher matcher) {
        return new TranscriptLineEvent.CourseLine(
                WHITESPACE.matcher(matcher.group(1).strip()).replaceAll(" "),
                matcher.group(2).strip(),
                new BigDecimal(matcher.group(3)),
                new BigDecimal(matcher.group(4)),
                matcher.group(5),
                new BigDecimal(matcher.group(6))
        );
    }

    /**
     * Normalizes a year and term (including the "Sprng" misspelling) into codes like {@code F23} or {@code S24}.
     */
    static String semesterCode(String year, String term) {
        String normalizedTerm = "Sprng".equals(term) ? "Spring" : term;
        return ("Fall".equals(normalizedTerm) ? "F" : "S") + year.substring(year.length() - 2);
    }
}
