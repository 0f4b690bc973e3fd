package com.example.certify.domain.model;

/**
 * Overall outcome of a certification run.
 * {@link #FAILED_INVALID} is reported whenever an unapproved course is present, regardless of credit totals.
 */
public enum CertificationVerdict {
    PASSED("Passed"),
    FAILED("Failed"),
    FAILED_INVALID("Failed-Invalid");

    private final String label;

    CertificationVerdict(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean passed() {
        return this == PASSED;
    }
}
