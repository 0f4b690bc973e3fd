package com.example.certify.config;

import com.example.certify.domain.parser.TranscriptMarkers;
import com.example.certify.domain.policy.CertificationPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Program policy and output settings bound from {@code certification.*}.
 * Defaults describe the MS Physics track.
 */
@ConfigurationProperties(prefix = "certification")
public record CertificationProperties(
        @DefaultValue("PHY") String homeDepartment,
        @DefaultValue({"PHY 680", "PHY 685", "PHY 690"}) List<String> researchCourses,
        @DefaultValue({"PHY 510", "EAS 502", "EAS 520", "MTH 573"}) List<String> electiveWhitelist,
        @DefaultValue("15") BigDecimal minCoreCredits,
        @DefaultValue("6") BigDecimal maxResearchCredits,
        @DefaultValue("6") BigDecimal maxLevel400Credits,
        @DefaultValue("30") BigDecimal minTotalCredits,
        @DefaultValue("400") int countedLevelFloor,
        @DefaultValue("500") int cappedLevelCeiling,
        @DefaultValue("Special Topics in Physics") String specialTopicsTitle,
        @DefaultValue("T") String transferGrade,
        @DefaultValue Markers markers,
        @DefaultValue Output output
) {

    /**
     * Literal tokens delimiting transcript sections.
     */
    public record Markers(
            @DefaultValue("Transfer Credit") String transfer,
            @DefaultValue("Beginning of Graduate Record") String graduate,
            @DefaultValue("Course Topic:") String topic
    ) {
    }

    /**
     * Where batch runs put their artifacts.
     */
    public record Output(
            @DefaultValue("output") Path dir,
            @DefaultValue("certification_summary.csv") String summaryFileName,
            @DefaultValue("ms_phy_track") String reportSuffix,
            @DefaultValue("Graduate Program Office") String preparedBy
    ) {
    }

    public CertificationPolicy toPolicy() {
        return new CertificationPolicy(
                homeDepartment,
                new LinkedHashSet<>(researchCourses),
                new LinkedHashSet<>(electiveWhitelist),
                minCoreCredits,
                maxResearchCredits,
                maxLevel400Credits,
                minTotalCredits,
                countedLevelFloor,
                cappedLevelCeiling,
                specialTopicsTitle,
                transferGrade
        );
    }

    public TranscriptMarkers toMarkers() {
        return new TranscriptMarkers(markers.transfer(), markers.graduate(), markers.topic());
    }
}
