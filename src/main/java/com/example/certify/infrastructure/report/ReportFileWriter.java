package com.example.certify.infrastructure.report;

import com.example.certify.infrastructure.exception.ReportWriteException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes per-transcript report files, replacing a previous report of the same student.
 */
@Service
public class ReportFileWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportFileWriter.class);

    /**
     * @param outputDir directory receiving the report, created when missing
     * @param fileName  report file name
     * @param content   CSV content
     * @return absolute path of the written file
     * @throws ReportWriteException when the file cannot be written
     */
    public Path write(Path outputDir, String fileName, String content) {
        Path target = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ReportWriteException("Unable to write report " + target, e);
        }
        log.debug("Wrote report {}", target.toAbsolutePath());
        return target.toAbsolutePath();
    }
}
