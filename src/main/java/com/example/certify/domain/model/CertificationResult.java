package com.example.certify.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Read-only aggregate computed from a ledger by the certification evaluator.
 * {@code researchCredits} is the raw research total; {@code researchApplied} is the capped amount.
 */
public record CertificationResult(
        BigDecimal coreCredits,
        BigDecimal researchCredits,
        BigDecimal researchApplied,
        BigDecimal level4xxCredits,
        BigDecimal totalCredits,
        int invalidCourseCount,
        boolean coreOk,
        boolean researchOk,
        boolean level4xxOk,
        boolean totalOk,
        boolean noInvalidOk,
        List<RequirementStatus> requirements,
        CertificationVerdict verdict,
        Instant evaluatedAt
) {

    public CertificationResult {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }

    public boolean passed() {
        return verdict.passed();
    }
}
