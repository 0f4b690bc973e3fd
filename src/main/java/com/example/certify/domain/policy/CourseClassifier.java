package com.example.certify.domain.policy;

import com.example.certify.domain.model.Classification;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless rules mapping a course code to its classification and numeric level.
 */
public class CourseClassifier {

    private static final Pattern LEVEL_PATTERN = Pattern.compile("\\b(\\d{3})\\b");
    private static final String TOPIC_TITLE_PREFIX = "Special Topics: ";
    private static final String TRANSFER_SUFFIX = " (Transfer)";

    private final CertificationPolicy policy;

    public CourseClassifier(CertificationPolicy policy) {
        this.policy = policy;
    }

    /**
     * Classifies a normalized {@code DEPT NUM} code.
     * Whitelisted codes win over the home-department rule, so {@code PHY 510} is an elective.
     *
     * @param code normalized course code
     * @return classification, never {@code null}
     */
    public Classification classify(String code) {
        if (policy.electiveWhitelist().contains(code)) {
            return Classification.ELECTIVE;
        }
        if (policy.homeDepartment().equals(departmentOf(code))) {
            return policy.researchCourses().contains(code) ? Classification.RESEARCH : Classification.CORE;
        }
        return Classification.INVALID;
    }

    /**
     * @param code normalized course code
     * @return first standalone three digit run, empty when the code carries none
     */
    public OptionalInt courseLevel(String code) {
        if (code == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = LEVEL_PATTERN.matcher(code);
        return matcher.find() ? OptionalInt.of(Integer.parseInt(matcher.group(1))) : OptionalInt.empty();
    }

    public boolean isTransferGrade(String grade) {
        return policy.transferGrade().equals(grade);
    }

    /**
     * Title stored for a freshly parsed course line, before any continuation line refines it.
     *
     * @param title          title as printed on the transcript
     * @param classification classification of the course
     * @param transferCredit whether the course was imported from another institution
     * @return title to keep on the record
     */
    public String initialTitle(String title, Classification classification, boolean transferCredit) {
        String base = classification == Classification.ELECTIVE ? policy.specialTopicsTitle() : title;
        return transferCredit ? base + TRANSFER_SUFFIX : base;
    }

    /**
     * Title of a special-topics record once its "Course Topic" line has been seen.
     *
     * @param topic          topic text following the marker
     * @param transferCredit whether the course was imported from another institution
     * @return refined title
     */
    public String topicTitle(String topic, boolean transferCredit) {
        String base = TOPIC_TITLE_PREFIX + topic;
        return transferCredit ? base + TRANSFER_SUFFIX : base;
    }

    public boolean isSpecialTopics(String code) {
        return policy.electiveWhitelist().contains(code);
    }

    public CertificationPolicy policy() {
        return policy;
    }

    private static String departmentOf(String code) {
        if (code == null) {
            return "";
        }
        int space = code.indexOf(' ');
        return space < 0 ? code : code.substring(0, space);
    }
}
