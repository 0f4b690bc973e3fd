package com.example.certify.application.service;

import com.example.certify.application.exception.ReportExportValidationException;
import com.example.certify.domain.model.CertificationResult;
import com.example.certify.domain.model.CertificationVerdict;
import com.example.certify.domain.model.CourseRecord;
import com.example.certify.domain.model.RequirementStatus;
import com.example.certify.domain.model.StudentIdentity;
import com.example.certify.domain.model.TranscriptCertification;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;

/**
 * Application-layer service that turns a certified ledger into report text: the per-transcript CSV,
 * the summary row and a plain-text rendering for the console.
 */
@Service
public class CertificationReportService {

    static final String LEDGER_HEADER = "Semester,Course Code,Title,Credits Earned,Classification,Grade";
    static final String SUMMARY_HEADER =
            "Student Name,Student ID,Core Credits,Research Applied,400-Level Credits,Total Credits,Certification";
    private static final Comparator<CourseRecord> REPORT_ORDER = Comparator
            .comparing((CourseRecord record) -> record.classification().label())
            .thenComparing(CourseRecord::semester)
            .thenComparing(CourseRecord::code);

    /**
     * Builds the per-transcript report: status line, identity lines, sorted ledger with totals row
     * and the itemized requirements table. Produced for passing and failing transcripts alike.
     *
     * @param certification certified transcript
     * @param preparedBy    name printed on the "Prepared by" line
     * @return CSV document as a string
     * @throws ReportExportValidationException when no certification is available
     */
    public String buildReport(TranscriptCertification certification, String preparedBy) {
        if (certification == null || certification.ledger() == null || certification.result() == null) {
            throw new ReportExportValidationException("No certification result available for export.");
        }
        StudentIdentity identity = certification.identity();
        CertificationResult result = certification.result();

        StringBuilder builder = new StringBuilder();
        builder.append(escape(statusLine(result.verdict()))).append('\n');
        builder.append("Prepared by,").append(escape(preparedBy)).append('\n');
        builder.append("Student Name,").append(escape(identity.name())).append('\n');
        // keeps spreadsheets from dropping leading zeros
        builder.append("Student ID,=\"").append(identity.id()).append("\"\n");

        builder.append(LEDGER_HEADER).append('\n');
        for (CourseRecord record : sortedRecords(certification)) {
            builder.append(escape(record.semester())).append(',')
                    .append(escape(record.code())).append(',')
                    .append(escape(record.title())).append(',')
                    .append(formatCredits(record.creditsEarned())).append(',')
                    .append(record.classification().label()).append(',')
                    .append(escape(record.grade()))
                    .append('\n');
        }
        builder.append(",,Total Credits Applied,").append(formatCredits(result.totalCredits())).append(",,\n");
        builder.append('\n');

        boolean first = true;
        for (RequirementStatus requirement : result.requirements()) {
            builder.append(first ? "Graduation Requirement" : "").append(',')
                    .append(escape(requirement.label())).append(',')
                    .append(formatValue(requirement.value())).append(',')
                    .append(requirement.statusText())
                    .append('\n');
            first = false;
        }
        return builder.toString();
    }

    public String summaryHeader() {
        return SUMMARY_HEADER;
    }

    /**
     * @param certification certified transcript
     * @return one summary CSV row without line terminator
     */
    public String summaryRow(TranscriptCertification certification) {
        StudentIdentity identity = certification.identity();
        CertificationResult result = certification.result();
        return String.join(",",
                escape(identity.name()),
                escape(identity.id()),
                formatValue(result.coreCredits()),
                formatValue(result.researchApplied()),
                formatValue(result.level4xxCredits()),
                formatValue(result.totalCredits()),
                result.verdict().label());
    }

    /**
     * Renders the course record and requirements as aligned text for terminal output.
     *
     * @param certification certified transcript
     * @return multi-line text
     */
    public String renderText(TranscriptCertification certification) {
        StringBuilder builder = new StringBuilder();
        builder.append(statusLine(certification.result().verdict())).append('\n');
        builder.append('\n').append("Course Record:").append('\n');
        builder.append(String.format("%-8s %-9s %-36s %7s %-14s %-5s%n",
                "Semester", "Course", "Title", "Credits", "Classification", "Grade"));
        for (CourseRecord record : sortedRecords(certification)) {
            builder.append(String.format("%-8s %-9s %-36s %7s %-14s %-5s%n",
                    record.semester(), record.code(), record.title(), formatCredits(record.creditsEarned()),
                    record.classification().label(), record.grade()));
        }
        builder.append(String.format("%-8s %-9s %-36s %7s%n", "", "", "Total Credits Applied",
                formatCredits(certification.result().totalCredits())));
        builder.append('\n').append("Graduation Requirements:").append('\n');
        for (RequirementStatus requirement : certification.result().requirements()) {
            builder.append(String.format("%-32s %6s  %s%n",
                    requirement.label(), formatValue(requirement.value()), requirement.statusText()));
        }
        return builder.toString();
    }

    private List<CourseRecord> sortedRecords(TranscriptCertification certification) {
        return certification.ledger().records().stream()
                .sorted(REPORT_ORDER)
                .toList();
    }

    private static String statusLine(CertificationVerdict verdict) {
        return switch (verdict) {
            case PASSED -> "Certification PASSED";
            case FAILED -> "Certification FAILED. Requirements not met.";
            case FAILED_INVALID -> "Certification FAILED: contains unapproved external courses.";
        };
    }

    private static String formatCredits(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String formatValue(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
