package com.example.certify.domain.model;

/**
 * Closed set of outcomes a course code can map to under a program's certification policy.
 */
public enum Classification {
    CORE("Core"),
    ELECTIVE("Elective"),
    RESEARCH("Research"),
    INVALID("Invalid");

    private final String label;

    Classification(String label) {
        this.label = label;
    }

    /**
     * @return label used in reports and the summary CSV
     */
    public String label() {
        return label;
    }
}
