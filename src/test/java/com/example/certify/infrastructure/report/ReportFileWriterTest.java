package com.example.certify.infrastructure.report;

import com.example.certify.infrastructure.exception.ReportWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReportFileWriterTest {

    private final ReportFileWriter writer = new ReportFileWriter();

    @TempDir
    Path tempDir;

    @Test
    void writesAndReplacesReport() throws Exception {
        Path outputDir = tempDir.resolve("reports");

        writer.write(outputDir, "jdoe_ms_phy_track.csv", "first\n");
        Path written = writer.write(outputDir, "jdoe_ms_phy_track.csv", "second\n");

        assertThat(written).isAbsolute();
        assertThat(Files.readString(written)).isEqualTo("second\n");
    }

    @Test
    void unwritableTargetRaisesReportWriteException() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file, not a directory");

        assertThrows(ReportWriteException.class, () -> writer.write(blocker, "jdoe_ms_phy_track.csv", "x"));
    }
}
