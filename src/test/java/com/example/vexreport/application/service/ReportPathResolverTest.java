package com.example.vexreport.application.service;

import com.example.vexreport.domain.exception.InvalidFileStemException;
import com.example.vexreport.domain.exception.InvalidOutputDirectoryException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for report destination derivation.
 */
class ReportPathResolverTest {

    @TempDir
    Path tempDir;

    /**
     * Without an output directory the report sits next to its input.
     */
    @Test
    void replacesExtensionNextToInput() {
        Path report = ReportPathResolver.resolve(null, Path.of("/a/b/report.json"));

        assertThat(report).isEqualTo(Path.of("/a/b/report.pdf"));
    }

    @Test
    void relocatesIntoOutputDirectory() {
        Path report = ReportPathResolver.resolve(Path.of("/out"), Path.of("/a/b/report.json"));

        assertThat(report).isEqualTo(Path.of("/out/report.pdf"));
    }

    @Test
    void keepsInnerDotsOfTheBaseName() {
        Path report = ReportPathResolver.resolve(null, Path.of("/a/app-1.2.3.cdx.xml"));

        assertThat(report).isEqualTo(Path.of("/a/app-1.2.3.cdx.pdf"));
    }

    /**
     * An existing regular file cannot act as the output directory.
     */
    @Test
    void rejectsFileAsOutputDirectory() throws IOException {
        Path notADirectory = Files.createFile(tempDir.resolve("x"));

        assertThrows(InvalidOutputDirectoryException.class,
                () -> ReportPathResolver.resolve(notADirectory, Path.of("/a/b/report.json")));
    }

    @Test
    void rejectsPathWithoutFileName() {
        assertThrows(InvalidFileStemException.class, () -> ReportPathResolver.resolve(null, Path.of("/")));
    }
}
