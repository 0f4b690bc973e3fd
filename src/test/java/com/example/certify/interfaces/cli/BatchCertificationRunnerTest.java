package com.example.certify.interfaces.cli;

import com.example.certify.application.service.CertificationReportService;
import com.example.certify.application.service.TranscriptCertificationService;
import com.example.certify.config.CertificationProperties;
import com.example.certify.domain.model.BatchCertificationResult;
import com.example.certify.domain.model.Classification;
import com.example.certify.domain.model.CourseRecord;
import com.example.certify.domain.model.SkippedTranscript;
import com.example.certify.domain.model.StudentIdentity;
import com.example.certify.domain.model.TranscriptCertification;
import com.example.certify.domain.model.TranscriptLedger;
import com.example.certify.domain.policy.CertificationEvaluator;
import com.example.certify.domain.policy.CertificationPolicy;
import com.example.certify.domain.policy.CourseClassifier;
import com.example.certify.infrastructure.report.ReportFileWriter;
import com.example.certify.infrastructure.report.SummaryCsvAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.BDDMockito;
import org.springframework.boot.DefaultApplicationArguments;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the batch entry point: per-student reports and the appended summary.
 */
class BatchCertificationRunnerTest {

    private final TranscriptCertificationService certificationService = mock(TranscriptCertificationService.class);

    @TempDir
    Path tempDir;

    @Test
    void detectsTranscriptArguments() {
        assertThat(BatchCertificationRunner.hasTranscriptArguments(new String[] {"jane.pdf"})).isTrue();
        assertThat(BatchCertificationRunner.hasTranscriptArguments(new String[] {"--output-dir=out"})).isFalse();
        assertThat(BatchCertificationRunner.hasTranscriptArguments(new String[0])).isFalse();
        assertThat(BatchCertificationRunner.hasTranscriptArguments(null)).isFalse();
        assertThat(BatchCertificationRunner.hasTranscriptArguments(new String[] {"--output-dir", "out"})).isFalse();
        assertThat(BatchCertificationRunner.hasTranscriptArguments(new String[] {"--output-dir", "out", "jane.pdf"}))
                .isTrue();
    }

    /**
     * Verifies that a space separated output directory is not mistaken for a transcript.
     *
     * @throws Exception when the output files cannot be read
     */
    @Test
    void acceptsSpaceSeparatedOutputDir() throws Exception {
        Path outputDir = tempDir.resolve("test_output");
        BDDMockito.given(certificationService.certifyAll(anyList())).willReturn(new BatchCertificationResult(
                List.of(certification("Jane Doe", "99990001")), List.of()));

        runner(tempDir.resolve("default")).run(
                new DefaultApplicationArguments("--output-dir", outputDir.toString(), "jane.pdf"));

        verify(certificationService).certifyAll(List.of(Path.of("jane.pdf")));
        assertThat(outputDir.resolve("jdoe_ms_phy_track.csv")).exists();
        assertThat(outputDir.resolve("certification_summary.csv")).exists();
        assertThat(tempDir.resolve("default")).doesNotExist();
    }

    @Test
    void rejectsOutputDirWithoutValue() {
        BatchCertificationRunner runner = runner(tempDir.resolve("default"));

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> runner.run(new DefaultApplicationArguments("jane.pdf", "--output-dir")));

        assertThat(exception.getMessage()).contains("--output-dir requires a directory");
        verify(certificationService, never()).certifyAll(anyList());
    }

    @Test
    void summaryWriteFailureDoesNotAbortRun() throws Exception {
        Path outputDir = tempDir.resolve("out");
        Files.createDirectories(outputDir.resolve("certification_summary.csv"));
        BDDMockito.given(certificationService.certifyAll(anyList())).willReturn(new BatchCertificationResult(
                List.of(certification("Jane Doe", "99990001")), List.of()));

        runner(tempDir.resolve("default")).run(
                new DefaultApplicationArguments("jane.pdf", "--output-dir=" + outputDir));

        assertThat(outputDir.resolve("jdoe_ms_phy_track.csv")).exists();
        assertThat(outputDir.resolve("certification_summary.csv")).isDirectory();
    }

    @Test
    void doesNothingWithoutTranscripts() throws Exception {
        runner(tempDir.resolve("default")).run(new DefaultApplicationArguments("--output-dir=" + tempDir));

        verify(certificationService, never()).certifyAll(anyList());
    }

    /**
     * Verifies that a report is written for every certified transcript and a summary row appended.
     *
     * @throws Exception when the output files cannot be read
     */
    @Test
    void writesReportsAndSummary() throws Exception {
        Path outputDir = tempDir.resolve("out");
        BDDMockito.given(certificationService.certifyAll(anyList())).willReturn(new BatchCertificationResult(
                List.of(certification("Jane Doe", "99990001")),
                List.of(new SkippedTranscript("broken.pdf", "Unable to extract text"))));

        runner(tempDir.resolve("default")).run(
                new DefaultApplicationArguments("jane.pdf", "broken.pdf", "--output-dir=" + outputDir));

        Path report = outputDir.resolve("jdoe_ms_phy_track.csv");
        assertThat(report).exists();
        assertThat(Files.readString(report)).startsWith("Certification FAILED. Requirements not met.\n");
        assertThat(Files.readAllLines(outputDir.resolve("certification_summary.csv"))).containsExactly(
                "Student Name,Student ID,Core Credits,Research Applied,400-Level Credits,Total Credits,Certification",
                "Jane Doe,99990001,3,0,0,3,Failed");
        assertThat(tempDir.resolve("default")).doesNotExist();
    }

    @Test
    void summaryAccumulatesAcrossRuns() throws Exception {
        Path outputDir = tempDir.resolve("default");
        BDDMockito.given(certificationService.certifyAll(anyList()))
                .willReturn(new BatchCertificationResult(List.of(certification("Jane Doe", "1")), List.of()))
                .willReturn(new BatchCertificationResult(List.of(certification("John Roe", "2")), List.of()));
        BatchCertificationRunner runner = runner(outputDir);

        runner.run(new DefaultApplicationArguments("jane.pdf"));
        runner.run(new DefaultApplicationArguments("john.pdf"));

        assertThat(Files.readAllLines(outputDir.resolve("certification_summary.csv"))).hasSize(3);
        assertThat(outputDir.resolve("jroe_ms_phy_track.csv")).exists();
    }

    private BatchCertificationRunner runner(Path defaultOutputDir) {
        CertificationProperties properties = new CertificationProperties(
                "PHY", List.of("PHY 680", "PHY 685", "PHY 690"), List.of("PHY 510", "EAS 502", "EAS 520", "MTH 573"),
                BigDecimal.valueOf(15), BigDecimal.valueOf(6), BigDecimal.valueOf(6), BigDecimal.valueOf(30),
                400, 500, "Special Topics in Physics", "T",
                new CertificationProperties.Markers("Transfer Credit", "Beginning of Graduate Record", "Course Topic:"),
                new CertificationProperties.Output(defaultOutputDir, "certification_summary.csv", "ms_phy_track",
                        "Graduate Program Office"));
        return new BatchCertificationRunner(certificationService, new CertificationReportService(),
                new ReportFileWriter(), new SummaryCsvAppender(), properties);
    }

    private static TranscriptCertification certification(String name, String id) {
        CourseClassifier classifier = new CourseClassifier(CertificationPolicy.physicsDefaults());
        BigDecimal credits = new BigDecimal("3.00");
        TranscriptLedger ledger = new TranscriptLedger(new StudentIdentity(name, id), List.of(
                new CourseRecord("F23", "PHY 543", "Quantum Mechanics I", credits, credits, "A",
                        new BigDecimal("12.000"), false, Classification.CORE)));
        return new TranscriptCertification(name + ".pdf", ledger,
                new CertificationEvaluator(classifier, Clock.systemUTC()).evaluate(ledger));
    }
}
