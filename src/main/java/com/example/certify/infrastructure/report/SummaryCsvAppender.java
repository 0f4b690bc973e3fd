package com.example.certify.infrastructure.report;

import com.example.certify.infrastructure.exception.ReportWriteException;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Appends rows to the cross-transcript summary CSV. Existing rows are never rewritten;
 * the header is written only when the file is created. Appends are serialized by a lock.
 */
@Service
public class SummaryCsvAppender {

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param summaryFile summary CSV location
     * @param header      header line written for a new file
     * @param rows        rows to append, without line terminators
     * @throws ReportWriteException when the summary cannot be written
     */
    public void append(Path summaryFile, String header, List<String> rows) {
        if (rows == null || rows.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            Path parent = summaryFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            StringBuilder builder = new StringBuilder();
            if (!Files.exists(summaryFile) || Files.size(summaryFile) == 0) {
                builder.append(header).append('\n');
            }
            for (String row : rows) {
                builder.append(row).append('\n');
            }
            Files.writeString(summaryFile, builder.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new ReportWriteException("Unable to append to summary " + summaryFile, e);
        } finally {
            lock.unlock();
        }
    }
}
