package com.example.certify.config;

import com.example.certify.domain.parser.IdentityExtractor;
import com.example.certify.domain.parser.TranscriptLedgerAssembler;
import com.example.certify.domain.parser.TranscriptLineClassifier;
import com.example.certify.domain.policy.CertificationEvaluator;
import com.example.certify.domain.policy.CertificationPolicy;
import com.example.certify.domain.policy.CourseClassifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free domain components from {@link CertificationProperties}.
 */
@Configuration
@EnableConfigurationProperties(CertificationProperties.class)
public class CertificationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CertificationConfiguration.class);

    @Bean
    public CertificationPolicy certificationPolicy(CertificationProperties properties) {
        CertificationPolicy policy = properties.toPolicy();
        log.info("Certification policy for {}: core>={}, research<={}, {}-level<={}, total>={}",
                policy.homeDepartment(), policy.minCoreCredits(), policy.maxResearchCredits(),
                policy.countedLevelFloor(), policy.maxLevel400Credits(), policy.minTotalCredits());
        return policy;
    }

    @Bean
    public CourseClassifier courseClassifier(CertificationPolicy policy) {
        return new CourseClassifier(policy);
    }

    @Bean
    public TranscriptLineClassifier transcriptLineClassifier(CertificationProperties properties) {
        return new TranscriptLineClassifier(properties.toMarkers(), properties.transferGrade());
    }

    @Bean
    public TranscriptLedgerAssembler transcriptLedgerAssembler(TranscriptLineClassifier lineClassifier,
                                                               CourseClassifier courseClassifier) {
        return new TranscriptLedgerAssembler(lineClassifier, courseClassifier);
    }

    @Bean
    public IdentityExtractor identityExtractor() {
        return new IdentityExtractor();
    }

    @Bean
    public Clock certificationClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CertificationEvaluator certificationEvaluator(CourseClassifier courseClassifier, Clock certificationClock) {
        return new CertificationEvaluator(courseClassifier, certificationClock);
    }
}
