package com.example.vexreport.application.service;

import com.example.vexreport.domain.exception.InvalidFileStemException;
import com.example.vexreport.domain.exception.InvalidOutputDirectoryException;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Derives the report path for an input file: the input's base name with the report extension, either next to
 * the input or inside the configured output directory.
 */
public final class ReportPathResolver {

    public static final String REPORT_EXTENSION = "pdf";

    private ReportPathResolver() {
    }

	/**
	 * Resolves the destination of the report for {@code input}.
	 *
	 * @param outputDir output directory or {@code null} to write next to the input
	 * @param input     input document path
	 * @return report path
	 * @throws InvalidFileStemException        when {@code input} has no file name
	 * @throws InvalidOutputDirectoryException when {@code outputDir} is an existing regular file
	 */
    public static Path resolve(Path outputDir, Path input) {
        String reportName = stemOf(input) + "." + REPORT_EXTENSION;
        if (outputDir == null) {
            return input.resolveSibling(reportName);
        }
        if (Files.isRegularFile(outputDir)) {
            throw new InvalidOutputDirectoryException(outputDir);
        }
        return outputDir.resolve(reportName);
    }

    private static String stemOf(Path input) {
        if (input == null || input.getFileName() == null) {
            throw new InvalidFileStemException(input);
        }
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        if (stem.isEmpty()) {
            throw new InvalidFileStemException(input);
        }
        return stem;
    }
}
