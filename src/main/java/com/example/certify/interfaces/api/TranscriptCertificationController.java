package com.example.certify.interfaces.api;

import com.example.certify.application.service.CertificationReportService;
import com.example.certify.application.service.ReportFileNames;
import com.example.certify.application.service.TranscriptCertificationService;
import com.example.certify.config.CertificationProperties;
import com.example.certify.domain.model.BatchCertificationResult;
import com.example.certify.domain.model.TranscriptCertification;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Interfaces-layer controller that certifies uploaded transcripts and streams certification reports.
 */
@Controller
public class TranscriptCertificationController {

    private final TranscriptCertificationService certificationService;
    private final CertificationReportService reportService;
    private final CertificationProperties properties;

    public TranscriptCertificationController(TranscriptCertificationService certificationService,
                                             CertificationReportService reportService,
                                             CertificationProperties properties) {
        this.certificationService = certificationService;
        this.reportService = reportService;
        this.properties = properties;
    }

    /**
     * Certifies every uploaded transcript; unusable ones are listed as skipped instead of failing the request.
     *
     * @param files uploaded PDFs
     * @return JSON batch result
     */
    @PostMapping(value = "/api/certify", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<BatchCertificationResult> certify(@RequestParam(value = "files", required = false) List<MultipartFile> files) {
        return ResponseEntity.ok(certificationService.certifyUploads(files));
    }

    /**
     * Certifies one transcript and returns its report as a CSV download.
     *
     * @param file uploaded PDF
     * @return CSV document as a {@link ResponseEntity}
     */
    @PostMapping("/api/certify/report")
    public ResponseEntity<byte[]> report(@RequestParam(value = "file", required = false) MultipartFile file) {
        TranscriptCertification certification = certificationService.certify(file);
        String csv = reportService.buildReport(certification, properties.output().preparedBy());
        String fileName = ReportFileNames.reportFileName(certification.identity(), properties.output().reportSuffix());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(MediaType.TEXT_PLAIN)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
