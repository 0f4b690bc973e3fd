package com.example.certify.interfaces.cli;

import com.example.certify.application.service.CertificationReportService;
import com.example.certify.application.service.ReportFileNames;
import com.example.certify.application.service.TranscriptCertificationService;
import com.example.certify.config.CertificationProperties;
import com.example.certify.domain.model.BatchCertificationResult;
import com.example.certify.domain.model.SkippedTranscript;
import com.example.certify.domain.model.TranscriptCertification;
import com.example.certify.infrastructure.exception.ReportWriteException;
import com.example.certify.infrastructure.report.ReportFileWriter;
import com.example.certify.infrastructure.report.SummaryCsvAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch entry point: certifies every transcript passed as a non-option argument, writes one report per
 * student and appends all results to the summary CSV. Does nothing when no transcript is given.
 */
@Component
public class BatchCertificationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchCertificationRunner.class);
    static final String OUTPUT_DIR_OPTION = "output-dir";

    private final TranscriptCertificationService certificationService;
    private final CertificationReportService reportService;
    private final ReportFileWriter reportFileWriter;
    private final SummaryCsvAppender summaryAppender;
    private final CertificationProperties properties;

    public BatchCertificationRunner(TranscriptCertificationService certificationService,
                                    CertificationReportService reportService,
                                    ReportFileWriter reportFileWriter,
                                    SummaryCsvAppender summaryAppender,
                                    CertificationProperties properties) {
        this.certificationService = certificationService;
        this.reportService = reportService;
        this.reportFileWriter = reportFileWriter;
        this.summaryAppender = summaryAppender;
        this.properties = properties;
    }

    /**
     * @param args raw command line
     * @return {@code true} when at least one argument names a transcript
     */
    public static boolean hasTranscriptArguments(String[] args) {
        return !BatchArguments.parse(args).transcripts().isEmpty();
    }

    @Override
    public void run(ApplicationArguments args) {
        BatchArguments batchArguments = BatchArguments.parse(args.getSourceArgs());
        if (batchArguments.transcripts().isEmpty()) {
            return;
        }
        if (batchArguments.outputDirMissing()) {
            throw new IllegalArgumentException("Option --" + OUTPUT_DIR_OPTION
                    + " requires a directory, e.g. --" + OUTPUT_DIR_OPTION + " output <transcript.pdf>");
        }
        Path outputDir = batchArguments.outputDir() != null
                ? Path.of(batchArguments.outputDir())
                : properties.output().dir();
        List<Path> paths = batchArguments.transcripts().stream().map(Path::of).toList();

        BatchCertificationResult batch = certificationService.certifyAll(paths);
        List<String> summaryRows = new ArrayList<>();
        for (TranscriptCertification certification : batch.certified()) {
            log.info("{}{}", System.lineSeparator(), reportService.renderText(certification));
            writeReport(outputDir, certification);
            summaryRows.add(reportService.summaryRow(certification));
        }
        for (SkippedTranscript skipped : batch.skipped()) {
            log.warn("Not certified: {} ({})", skipped.source(), skipped.reason());
        }

        if (!summaryRows.isEmpty()) {
            writeSummary(outputDir.resolve(properties.output().summaryFileName()), summaryRows);
        }
        log.info("Processed {} transcript(s): {} certified, {} skipped",
                paths.size(), batch.certified().size(), batch.skipped().size());
    }

    private void writeReport(Path outputDir, TranscriptCertification certification) {
        String fileName = ReportFileNames.reportFileName(certification.identity(), properties.output().reportSuffix());
        try {
            Path written = reportFileWriter.write(outputDir, fileName,
                    reportService.buildReport(certification, properties.output().preparedBy()));
            log.info("Report for {} saved to: {}", certification.identity().name(), written);
        } catch (ReportWriteException ex) {
            log.warn("Could not write report for {}: {}", certification.source(), ex.getMessage());
        }
    }

    private void writeSummary(Path summaryFile, List<String> summaryRows) {
        try {
            summaryAppender.append(summaryFile, reportService.summaryHeader(), summaryRows);
            log.info("Summary CSV saved to: {}", summaryFile.toAbsolutePath());
        } catch (ReportWriteException ex) {
            log.warn("Could not append {} row(s) to summary {}: {}", summaryRows.size(), summaryFile, ex.getMessage());
        }
    }

    /**
     * Transcript paths and output directory read from the raw command line.
     * Accepts both {@code --output-dir=DIR} and {@code --output-dir DIR}; other {@code --} options are left to Spring.
     *
     * @param transcripts      transcript paths in command line order
     * @param outputDir        output directory, {@code null} when not given
     * @param outputDirMissing whether {@code --output-dir} appeared without a value
     */
    record BatchArguments(List<String> transcripts, String outputDir, boolean outputDirMissing) {

        private static final String OPTION = "--" + OUTPUT_DIR_OPTION;

        static BatchArguments parse(String[] args) {
            List<String> transcripts = new ArrayList<>();
            String outputDir = null;
            boolean missing = false;
            if (args == null) {
                return new BatchArguments(transcripts, null, false);
            }
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (arg == null || arg.isBlank()) {
                    continue;
                }
                if (arg.equals(OPTION)) {
                    if (i + 1 < args.length && args[i + 1] != null && !args[i + 1].isBlank()
                            && !args[i + 1].startsWith("--")) {
                        outputDir = args[++i];
                        missing = false;
                    } else {
                        missing = true;
                    }
                } else if (arg.startsWith(OPTION + "=")) {
                    String value = arg.substring(OPTION.length() + 1);
                    missing = value.isBlank();
                    outputDir = missing ? null : value;
                } else if (!arg.startsWith("--")) {
                    transcripts.add(arg);
                }
            }
            return new BatchArguments(List.copyOf(transcripts), outputDir, missing);
        }
    }
}
