package com.example.certify.application.service;

import com.example.certify.TranscriptPdfFixtures;
import com.example.certify.domain.exception.EmptyLedgerException;
import com.example.certify.domain.exception.IdentityNotFoundException;
import com.example.certify.domain.exception.TranscriptFileRequiredException;
import com.example.certify.domain.exception.TranscriptNotFoundException;
import com.example.certify.domain.exception.TranscriptPathRequiredException;
import com.example.certify.domain.exception.UnsupportedTranscriptFormatException;
import com.example.certify.domain.model.BatchCertificationResult;
import com.example.certify.domain.model.CertificationVerdict;
import com.example.certify.domain.model.TranscriptCertification;
import com.example.certify.domain.model.TranscriptPage;
import com.example.certify.domain.parser.IdentityExtractor;
import com.example.certify.domain.parser.TranscriptLedgerAssembler;
import com.example.certify.domain.parser.TranscriptLineClassifier;
import com.example.certify.domain.parser.TranscriptMarkers;
import com.example.certify.domain.policy.CertificationEvaluator;
import com.example.certify.domain.policy.CertificationPolicy;
import com.example.certify.domain.policy.CourseClassifier;
import com.example.certify.infrastructure.exception.PdfProcessingException;
import com.example.certify.infrastructure.pdf.PdfBoxTranscriptReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.BDDMockito;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;

/**
 * Unit tests covering the certification pipeline and its per-transcript failure isolation.
 */
class TranscriptCertificationServiceTest {

    private static final String HEADER = "Name: Jane Doe\nStudent ID: 99990001\n";

    private final PdfBoxTranscriptReader reader = mock(PdfBoxTranscriptReader.class);
    private final TranscriptCertificationService service = newService(reader);

    @TempDir
    Path tempDir;

    @Test
    void certifiesPassingTranscript() {
        TranscriptCertification certification = service.certifyPages(List.of(passingPage()), "jane.pdf");

        assertThat(certification.source()).isEqualTo("jane.pdf");
        assertThat(certification.identity().name()).isEqualTo("Jane Doe");
        assertThat(certification.ledger().records()).hasSize(9);
        assertThat(certification.result().verdict()).isEqualTo(CertificationVerdict.PASSED);
    }

    @Test
    void missingIdentityIsRejected() {
        TranscriptPage page = new TranscriptPage(passingPage().columnLines(), "Name: Jane Doe\n");

        assertThrows(IdentityNotFoundException.class, () -> service.certifyPages(List.of(page), "jane.pdf"));
    }

    @Test
    void transcriptWithoutCoursesIsRejected() {
        TranscriptPage page = new TranscriptPage(List.of("2023 Fall", "Term GPA 4.000"), HEADER);

        assertThrows(EmptyLedgerException.class, () -> service.certifyPages(List.of(page), "jane.pdf"));
    }

    @Test
    void transferOnlyTranscriptIsRejected() {
        TranscriptPage page = new TranscriptPage(List.of(
                "Transfer Credit from Riverside Community College",
                "Transfer",
                "PHY 501  Classical Mechanics  3.00  3.00  T  0.000"), HEADER);

        EmptyLedgerException exception = assertThrows(EmptyLedgerException.class,
                () -> service.certifyPages(List.of(page), "transfer-only.pdf"));
        assertThat(exception.source()).isEqualTo("transfer-only.pdf");
    }

    /**
     * Verifies that one unusable transcript is skipped while the rest of the batch is certified.
     *
     * @throws Exception when the fixture files cannot be written
     */
    @Test
    void batchSkipsFailingTranscripts() throws Exception {
        Path good = Files.write(tempDir.resolve("good.pdf"), new byte[] {1});
        Path unreadable = Files.write(tempDir.resolve("broken.pdf"), new byte[] {2});
        Path missing = tempDir.resolve("missing.pdf");
        BDDMockito.given(reader.readPages(any(byte[].class), eq(good.toString())))
                .willReturn(List.of(passingPage()));
        BDDMockito.given(reader.readPages(any(byte[].class), eq(unreadable.toString())))
                .willThrow(new PdfProcessingException("Unable to extract text", new RuntimeException("boom")));

        BatchCertificationResult batch = service.certifyAll(List.of(good, unreadable, missing));

        assertThat(batch.certified()).extracting(TranscriptCertification::source).containsExactly(good.toString());
        assertThat(batch.skipped()).hasSize(2);
        assertThat(batch.skipped().get(0).source()).isEqualTo(unreadable.toString());
        assertThat(batch.skipped().get(1).reason()).contains("Transcript not found");
    }

    @Test
    void pathValidation() {
        assertThrows(TranscriptPathRequiredException.class, () -> service.certify((Path) null));
        assertThrows(TranscriptNotFoundException.class, () -> service.certify(tempDir.resolve("none.pdf")));
    }

    @Test
    void uploadValidation() {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);
        MockMultipartFile text = new MockMultipartFile("file", "notes.txt", "text/plain", "hello".getBytes());

        assertThrows(TranscriptFileRequiredException.class, () -> service.certify(empty));
        assertThrows(UnsupportedTranscriptFormatException.class, () -> service.certify(text));
        assertThrows(TranscriptFileRequiredException.class, () -> service.certifyUploads(List.of()));
    }

    @Test
    void uploadsAreCertifiedIndividually() {
        BDDMockito.given(reader.readPages(any(byte[].class), anyString())).willReturn(List.of(passingPage()));
        MockMultipartFile pdf = new MockMultipartFile("files", "jane.pdf", "application/pdf", new byte[] {1});
        MockMultipartFile text = new MockMultipartFile("files", "notes.txt", "text/plain", "hello".getBytes());

        BatchCertificationResult batch = service.certifyUploads(List.of(pdf, text));

        assertThat(batch.certified()).hasSize(1);
        assertThat(batch.skipped()).singleElement().satisfies(skipped -> assertThat(skipped.source()).isEqualTo("notes.txt"));
    }

    /**
     * Verifies the full pipeline against a real two-column PDF.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void certifiesRenderedPdf() throws Exception {
        TranscriptCertificationService pdfService = newService(new PdfBoxTranscriptReader());
        byte[] pdf = TranscriptPdfFixtures.twoColumnTranscript("Jane Doe", "99990001",
                List.of(
                        "---------- Beginning of Graduate Record ----------",
                        "2023 Fall",
                        "PHY 543  Quantum Mechanics I  3.00  3.00  A  12.000",
                        "PHY 561  Electromagnetic Theory  3.00  3.00  A  12.000",
                        "PHY 544  Quantum Mechanics II  3.00  3.00  A  12.000"),
                List.of(
                        "2024 Spring",
                        "PHY 521  Statistical Mechanics  3.00  3.00  A  12.000",
                        "PHY 522  Solid State Physics  3.00  3.00  A  12.000",
                        "PHY 571  Nuclear Physics  3.00  3.00  A  12.000",
                        "PHY 510  Mathematical Methods  3.00  3.00  A  12.000",
                        "Course Topic: Group Theory",
                        "2024 Fall",
                        "EAS 520  Numerical Methods  3.00  3.00  A  12.000",
                        "PHY 690  Graduate Thesis  6.00  6.00  A  24.000"));

        TranscriptCertification certification = pdfService.certify(pdf, "jane.pdf");

        assertThat(certification.identity().id()).isEqualTo("99990001");
        assertThat(certification.ledger().records()).hasSize(9);
        assertThat(certification.ledger().records().get(0).semester()).isEqualTo("F23");
        assertThat(certification.ledger().records().get(6).title()).isEqualTo("Special Topics: Group Theory");
        assertThat(certification.result().totalCredits()).isEqualByComparingTo("30");
        assertThat(certification.result().verdict()).isEqualTo(CertificationVerdict.PASSED);
    }

    private static TranscriptPage passingPage() {
        return new TranscriptPage(List.of(
                "---------- Beginning of Graduate Record ----------",
                "2023 Fall",
                "PHY 543  Quantum Mechanics I  3.00  3.00  A  12.000",
                "PHY 561  Electromagnetic Theory  3.00  3.00  A  12.000",
                "PHY 544  Quantum Mechanics II  3.00  3.00  A  12.000",
                "2024 Spring",
                "PHY 521  Statistical Mechanics  3.00  3.00  A  12.000",
                "PHY 522  Solid State Physics  3.00  3.00  A  12.000",
                "PHY 571  Nuclear Physics  3.00  3.00  A  12.000",
                "PHY 510  Mathematical Methods  3.00  3.00  A  12.000",
                "EAS 520  Numerical Methods  3.00  3.00  A  12.000",
                "2024 Fall",
                "PHY 690  Graduate Thesis  6.00  6.00  A  24.000"
        ), HEADER);
    }

    private static TranscriptCertificationService newService(PdfBoxTranscriptReader reader) {
        CertificationPolicy policy = CertificationPolicy.physicsDefaults();
        CourseClassifier classifier = new CourseClassifier(policy);
        return new TranscriptCertificationService(
                reader,
                new IdentityExtractor(),
                new TranscriptLedgerAssembler(new TranscriptLineClassifier(TranscriptMarkers.defaults(), "T"), classifier),
                new CertificationEvaluator(classifier, Clock.fixed(Instant.parse("2025-06-05T12:00:00Z"), ZoneOffset.UTC)));
    }
}
