package com.example.certify.domain.policy;

import com.example.certify.domain.model.CertificationResult;
import com.example.certify.domain.model.CertificationVerdict;
import com.example.certify.domain.model.Classification;
import com.example.certify.domain.model.CourseRecord;
import com.example.certify.domain.model.RequirementStatus;
import com.example.certify.domain.model.TranscriptLedger;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.OptionalInt;

/**
 * Aggregates a ledger into credit totals and applies the certification policy.
 * The evaluator never mutates the ledger; identical input and clock yield an identical result.
 */
public class CertificationEvaluator {

    private final CourseClassifier classifier;
    private final Clock clock;

    public CertificationEvaluator(CourseClassifier classifier, Clock clock) {
        this.classifier = classifier;
        this.clock = clock;
    }

    /**
     * Evaluates the ledger against the policy held by the classifier.
     *
     * @param ledger finalized ledger
     * @return itemized result, produced for passing and failing ledgers alike
     */
    public CertificationResult evaluate(TranscriptLedger ledger) {
        CertificationPolicy policy = classifier.policy();
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal core = BigDecimal.ZERO;
        BigDecimal research = BigDecimal.ZERO;
        BigDecimal level4xx = BigDecimal.ZERO;
        int invalidCount = 0;

        for (CourseRecord record : ledger.records()) {
            if (record.classification() == Classification.INVALID) {
                invalidCount++;
                continue;
            }
            OptionalInt level = classifier.courseLevel(record.code());
            if (level.isEmpty() || level.getAsInt() < policy.countedLevelFloor()) {
                continue;
            }
            BigDecimal credits = record.creditsEarned();
            total = total.add(credits);
            if (record.classification() == Classification.CORE) {
                core = core.add(credits);
            }
            if (record.classification() == Classification.RESEARCH) {
                research = research.add(credits);
            }
            if (level.getAsInt() < policy.cappedLevelCeiling()) {
                level4xx = level4xx.add(credits);
            }
        }

        BigDecimal researchApplied = research.min(policy.maxResearchCredits());
        boolean coreOk = core.compareTo(policy.minCoreCredits()) >= 0;
        boolean totalOk = total.compareTo(policy.minTotalCredits()) >= 0;
        boolean researchOk = researchApplied.compareTo(policy.maxResearchCredits()) <= 0;
        boolean level4xxOk = level4xx.compareTo(policy.maxLevel400Credits()) <= 0;
        boolean noInvalidOk = invalidCount == 0;

        List<RequirementStatus> requirements = List.of(
                new RequirementStatus("≥" + plain(policy.minCoreCredits()) + " Core Credits", core, coreOk),
                new RequirementStatus("≤" + plain(policy.maxResearchCredits()) + " Research Credits Applied", researchApplied, researchOk),
                new RequirementStatus("≤" + plain(policy.maxLevel400Credits()) + " " + policy.countedLevelFloor() + "-Level Credits Applied", level4xx, level4xxOk),
                new RequirementStatus("≥" + plain(policy.minTotalCredits()) + " Total Credits", total, totalOk),
                new RequirementStatus("No Unapproved External Courses", BigDecimal.valueOf(invalidCount), noInvalidOk)
        );

        return new CertificationResult(
                core,
                research,
                researchApplied,
                level4xx,
                total,
                invalidCount,
                coreOk,
                researchOk,
                level4xxOk,
                totalOk,
                noInvalidOk,
                requirements,
                verdict(coreOk, researchOk, level4xxOk, totalOk, noInvalidOk),
                clock.instant()
        );
    }

    private CertificationVerdict verdict(boolean coreOk, boolean researchOk, boolean level4xxOk,
                                         boolean totalOk, boolean noInvalidOk) {
        if (!noInvalidOk) {
            return CertificationVerdict.FAILED_INVALID;
        }
        return coreOk && researchOk && level4xxOk && totalOk
                ? CertificationVerdict.PASSED
                : CertificationVerdict.FAILED;
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
