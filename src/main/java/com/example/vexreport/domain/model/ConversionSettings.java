package com.example.vexreport.domain.model;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration of one batch run, shared read-only by every conversion job.
 *
 * @param workingPath       file or directory to convert
 * @param outputDir         directory receiving the reports, {@code null} to write next to each input
 * @param fileTypesToProcess per-type switch, {@code false} means the type is ignored
 * @param maxJobs           0 for all available processors, 1 for sequential processing, N for N workers
 * @param showNoVulnsMsg    whether to render a banner when a document reports no vulnerabilities
 * @param pureBomNoVulns    whether inputs are plain bills of materials
 * @param showComponents    whether to list the document components
 * @param reportTitle       first heading of every report, {@code null} for the default
 * @param pdfMetaName       PDF document title, {@code null} for the default
 */
public record ConversionSettings(
        Path workingPath,
        Path outputDir,
        Map<InputFileType, Boolean> fileTypesToProcess,
        int maxJobs,
        boolean showNoVulnsMsg,
        boolean pureBomNoVulns,
        boolean showComponents,
        String reportTitle,
        String pdfMetaName
) {
    public static final String DEFAULT_REPORT_TITLE = "Vulnerability Report Document";
    public static final String DEFAULT_REPORT_TITLE_BOM = "Bill of Materials Document";
    public static final String DEFAULT_PDF_META_NAME = "Vulnerability Report";
    public static final String DEFAULT_PDF_META_NAME_BOM = "Bill of Materials";

    public ConversionSettings {
        Objects.requireNonNull(workingPath, "workingPath");
        EnumMap<InputFileType, Boolean> types = new EnumMap<>(InputFileType.class);
        for (InputFileType type : InputFileType.recognizedTypes()) {
            types.put(type, Boolean.TRUE);
        }
        if (fileTypesToProcess != null) {
            fileTypesToProcess.forEach((type, enabled) -> {
                if (type != null && type.isSupported()) {
                    types.put(type, enabled == null || enabled);
                }
            });
        }
        fileTypesToProcess = Map.copyOf(types);
    }

	/**
	 * Settings with every optional feature at its default, mainly for programmatic use.
	 *
	 * @param workingPath file or directory to convert
	 * @return default settings
	 */
    public static ConversionSettings defaults(Path workingPath) {
        return new ConversionSettings(workingPath, null, null, 0, true, false, true, null, null);
    }

	/**
	 * Derives the types that discovery must skip.
	 *
	 * @return types switched off by the user
	 */
    public Set<InputFileType> ignoredTypes() {
        EnumSet<InputFileType> ignored = EnumSet.noneOf(InputFileType.class);
        fileTypesToProcess.forEach((type, enabled) -> {
            if (!enabled) {
                ignored.add(type);
            }
        });
        return ignored;
    }

    public String effectiveReportTitle() {
        if (reportTitle != null && !reportTitle.isBlank()) {
            return reportTitle;
        }
        return pureBomNoVulns ? DEFAULT_REPORT_TITLE_BOM : DEFAULT_REPORT_TITLE;
    }

    public String effectivePdfMetaName() {
        if (pdfMetaName != null && !pdfMetaName.isBlank()) {
            return pdfMetaName;
        }
        return pureBomNoVulns ? DEFAULT_PDF_META_NAME_BOM : DEFAULT_PDF_META_NAME;
    }

    public ConversionSettings withOutputDir(Path newOutputDir) {
        return new ConversionSettings(workingPath, newOutputDir, fileTypesToProcess, maxJobs, showNoVulnsMsg,
                pureBomNoVulns, showComponents, reportTitle, pdfMetaName);
    }

    public ConversionSettings withMaxJobs(int newMaxJobs) {
        return new ConversionSettings(workingPath, outputDir, fileTypesToProcess, newMaxJobs, showNoVulnsMsg,
                pureBomNoVulns, showComponents, reportTitle, pdfMetaName);
    }

    public ConversionSettings withFileTypesToProcess(Map<InputFileType, Boolean> newFileTypes) {
        return new ConversionSettings(workingPath, outputDir, newFileTypes, maxJobs, showNoVulnsMsg,
                pureBomNoVulns, showComponents, reportTitle, pdfMetaName);
    }
}
