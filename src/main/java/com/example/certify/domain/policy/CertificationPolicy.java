package com.example.certify.domain.policy;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;

/**
 * Program-specific classification sets and credit thresholds.
 * Built from configuration so the same engine can certify other programs without code changes.
 */
public record CertificationPolicy(
        String homeDepartment,
        Set<String> researchCourses,
        Set<String> electiveWhitelist,
        BigDecimal minCoreCredits,
        BigDecimal maxResearchCredits,
        BigDecimal maxLevel400Credits,
        BigDecimal minTotalCredits,
        int countedLevelFloor,
        int cappedLevelCeiling,
        String specialTopicsTitle,
        String transferGrade
) {

    public CertificationPolicy {
        Objects.requireNonNull(homeDepartment, "homeDepartment");
        researchCourses = researchCourses == null ? Set.of() : Set.copyOf(researchCourses);
        electiveWhitelist = electiveWhitelist == null ? Set.of() : Set.copyOf(electiveWhitelist);
        Objects.requireNonNull(minCoreCredits, "minCoreCredits");
        Objects.requireNonNull(maxResearchCredits, "maxResearchCredits");
        Objects.requireNonNull(maxLevel400Credits, "maxLevel400Credits");
        Objects.requireNonNull(minTotalCredits, "minTotalCredits");
        if (cappedLevelCeiling <= countedLevelFloor) {
            throw new IllegalArgumentException("cappedLevelCeiling must be above countedLevelFloor");
        }
    }

    /**
     * Policy of the MS Physics track: 15 core, at most 6 research and 6 400-level credits, 30 in total.
     *
     * @return default policy
     */
    public static CertificationPolicy physicsDefaults() {
        return new CertificationPolicy(
                "PHY",
                Set.of("PHY 680", "PHY 685", "PHY 690"),
                Set.of("PHY 510", "EAS 502", "EAS 520", "MTH 573"),
                BigDecimal.valueOf(15),
                BigDecimal.valueOf(6),
                BigDecimal.valueOf(6),
                BigDecimal.valueOf(30),
                400,
                500,
                "Special Topics in Physics",
                "T"
        );
    }
}
