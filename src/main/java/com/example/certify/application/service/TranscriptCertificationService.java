package com.example.certify.application.service;

import com.example.certify.domain.exception.DomainException;
import com.example.certify.domain.exception.EmptyLedgerException;
import com.example.certify.domain.exception.IdentityNotFoundException;
import com.example.certify.domain.exception.TranscriptFileRequiredException;
import com.example.certify.domain.exception.TranscriptNotFoundException;
import com.example.certify.domain.exception.TranscriptPathRequiredException;
import com.example.certify.domain.exception.UnsupportedTranscriptFormatException;
import com.example.certify.domain.model.BatchCertificationResult;
import com.example.certify.domain.model.CertificationResult;
import com.example.certify.domain.model.SkippedTranscript;
import com.example.certify.domain.model.StudentIdentity;
import com.example.certify.domain.model.TranscriptCertification;
import com.example.certify.domain.model.TranscriptLedger;
import com.example.certify.domain.model.TranscriptPage;
import com.example.certify.domain.parser.IdentityExtractor;
import com.example.certify.domain.parser.TranscriptLedgerAssembler;
import com.example.certify.domain.policy.CertificationEvaluator;
import com.example.certify.infrastructure.exception.InfrastructureException;
import com.example.certify.infrastructure.exception.PdfProcessingException;
import com.example.certify.infrastructure.pdf.PdfBoxTranscriptReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Application-layer service that runs the certification pipeline for one transcript or a batch:
 * text extraction, identity lookup, ledger assembly and policy evaluation.
 */
@Service
public class TranscriptCertificationService {

    private static final Logger log = LoggerFactory.getLogger(TranscriptCertificationService.class);

    private final PdfBoxTranscriptReader transcriptReader;
    private final IdentityExtractor identityExtractor;
    private final TranscriptLedgerAssembler ledgerAssembler;
    private final CertificationEvaluator evaluator;

    public TranscriptCertificationService(PdfBoxTranscriptReader transcriptReader,
                                          IdentityExtractor identityExtractor,
                                          TranscriptLedgerAssembler ledgerAssembler,
                                          CertificationEvaluator evaluator) {
        this.transcriptReader = transcriptReader;
        this.identityExtractor = identityExtractor;
        this.ledgerAssembler = ledgerAssembler;
        this.evaluator = evaluator;
    }

    /**
     * Certifies an uploaded transcript.
     *
     * @param file uploaded PDF
     * @return ledger and evaluation
     * @throws TranscriptFileRequiredException      when the file is null or empty
     * @throws UnsupportedTranscriptFormatException when the MIME type/name does not look like a PDF
     * @throws PdfProcessingException               when the bytes cannot be read
     */
    public TranscriptCertification certify(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new TranscriptFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedTranscriptFormatException(file.getOriginalFilename());
        }
        String fileName = resolveFileName(file);
        try {
            return certify(file.getBytes(), fileName);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded transcript " + fileName, e);
        }
    }

    /**
     * Certifies a transcript stored on disk.
     *
     * @param pdfPath path pointing to a PDF file
     * @return ledger and evaluation
     * @throws TranscriptPathRequiredException when {@code pdfPath} is null
     * @throws TranscriptNotFoundException     when the path does not exist
     * @throws PdfProcessingException          when the file cannot be read
     */
    public TranscriptCertification certify(Path pdfPath) {
        if (pdfPath == null) {
            throw new TranscriptPathRequiredException();
        }
        if (!Files.exists(pdfPath)) {
            throw new TranscriptNotFoundException(pdfPath.toAbsolutePath().toString());
        }
        try {
            return certify(Files.readAllBytes(pdfPath), pdfPath.toString());
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the transcript at " + pdfPath, e);
        }
    }

    /**
     * @param bytes  PDF bytes
     * @param source logical name used in diagnostics
     * @return ledger and evaluation
     */
    public TranscriptCertification certify(byte[] bytes, String source) {
        return certifyPages(transcriptReader.readPages(bytes, source), source);
    }

    /**
     * Runs identity extraction, ledger assembly and evaluation on already extracted pages.
     *
     * @param pages  transcript pages in order
     * @param source logical name used in diagnostics
     * @return ledger and evaluation
     * @throws IdentityNotFoundException when the name or student number is missing
     * @throws EmptyLedgerException      when the graduate record was never reached or held no course
     */
    public TranscriptCertification certifyPages(List<TranscriptPage> pages, String source) {
        StudentIdentity identity = identityExtractor.extract(pages);
        if (!identity.complete()) {
            throw new IdentityNotFoundException(source);
        }
        List<String> lines = pages.stream()
                .flatMap(page -> page.columnLines().stream())
                .toList();
        TranscriptLedger ledger = ledgerAssembler.assemble(identity, lines);
        if (ledger.isEmpty()) {
            throw new EmptyLedgerException(source);
        }
        CertificationResult result = evaluator.evaluate(ledger);
        log.info("Certification {} for {} ({}): {} course record(s), {} total credits",
                result.verdict().label(), identity.name(), identity.id(),
                ledger.records().size(), result.totalCredits());
        return new TranscriptCertification(source, ledger, result);
    }

    /**
     * Certifies every transcript on disk. A failing transcript is skipped with a diagnostic and
     * never aborts the remaining ones.
     *
     * @param pdfPaths transcript paths
     * @return certified transcripts and skip diagnostics, in input order
     */
    public BatchCertificationResult certifyAll(List<Path> pdfPaths) {
        return certifyEach(pdfPaths, path -> path == null ? "<null>" : path.toString(), this::certify);
    }

    /**
     * Certifies uploaded transcripts with the same per-transcript isolation as {@link #certifyAll(List)}.
     *
     * @param files uploaded PDFs
     * @return certified transcripts and skip diagnostics, in input order
     * @throws TranscriptFileRequiredException when no file was uploaded
     */
    public BatchCertificationResult certifyUploads(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new TranscriptFileRequiredException();
        }
        return certifyEach(files, this::resolveFileName, this::certify);
    }

    private <T> BatchCertificationResult certifyEach(List<T> inputs,
                                                     Function<T, String> nameOf,
                                                     Function<T, TranscriptCertification> certification) {
        List<TranscriptCertification> certified = new ArrayList<>();
        List<SkippedTranscript> skipped = new ArrayList<>();
        for (T input : inputs) {
            String source = nameOf.apply(input);
            try {
                certified.add(certification.apply(input));
            } catch (DomainException | InfrastructureException ex) {
                log.warn("Skipping transcript {}: {}", source, ex.getMessage());
                skipped.add(new SkippedTranscript(source, ex.getMessage()));
            }
        }
        return new BatchCertificationResult(certified, skipped);
    }

    /**
     * Performs a lightweight PDF detection check based on MIME type and file name.
     *
     * @param file uploaded file
     * @return {@code true} when the content type or suffix indicates a PDF
     */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file == null ? null : file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }
}
