package com.example.vexreport.infrastructure.config;

import com.example.vexreport.application.exception.ConversionSettingsException;
import com.example.vexreport.domain.model.ConversionSettings;
import com.example.vexreport.domain.model.InputFileType;
import com.example.vexreport.infrastructure.concurrency.JobDispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;

/**
 * Externalized run configuration bound from {@code vexreport.*} properties, command-line options and
 * environment variables.
 */
@ConfigurationProperties(prefix = "vexreport")
public class ReportProperties {

    private static final Logger log = LoggerFactory.getLogger(ReportProperties.class);

    private String input = ".";
    private String outputDir;
    private int maxJobs = 0;
    private final Process process = new Process();
    private boolean showNoVulnsMsg = true;
    private boolean pureBomNoVulns = false;
    private boolean showComponents = true;
    private String reportTitle;
    private String pdfMetaName;

    /**
     * Per-type processing switches ({@code vexreport.process.json}, {@code vexreport.process.xml}).
     */
    public static class Process {

        private boolean json = true;
        private boolean xml = true;

        public boolean isJson() {
            return json;
        }

        public void setJson(boolean json) {
            this.json = json;
        }

        public boolean isXml() {
            return xml;
        }

        public void setXml(boolean xml) {
            this.xml = xml;
        }
    }

	/**
	 * Validates the bound values and freezes them into the settings of one run.
	 *
	 * @param inputOverride positional input path taking precedence over {@code vexreport.input}, may be {@code null}
	 * @return immutable run settings
	 * @throws ConversionSettingsException when the job count is out of range or the input path is missing
	 */
    public ConversionSettings toSettings(String inputOverride) {
        String rawInput = inputOverride != null && !inputOverride.isBlank() ? inputOverride : input;
        if (rawInput == null || rawInput.isBlank()) {
            throw new ConversionSettingsException("An input file or directory is required");
        }
        Path workingPath = Paths.get(rawInput);
        if (!Files.exists(workingPath)) {
            throw new ConversionSettingsException("Input path does not exist: " + workingPath);
        }
        if (maxJobs < 0 || maxJobs > JobDispatcher.MAX_JOBS) {
            throw new ConversionSettingsException(
                    "max-jobs must be between 0 and " + JobDispatcher.MAX_JOBS + " but was " + maxJobs);
        }

        Map<InputFileType, Boolean> fileTypes = new EnumMap<>(InputFileType.class);
        fileTypes.put(InputFileType.JSON, process.isJson());
        fileTypes.put(InputFileType.XML, process.isXml());
        if (!process.isJson() && !process.isXml()) {
            log.warn("Both JSON and XML processing are deactivated; re-enabling JSON processing");
            fileTypes.put(InputFileType.JSON, Boolean.TRUE);
        }

        Path output = outputDir == null || outputDir.isBlank() ? null : Paths.get(outputDir);
        return new ConversionSettings(workingPath, output, fileTypes, maxJobs, showNoVulnsMsg, pureBomNoVulns,
                showComponents, reportTitle, pdfMetaName);
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public int getMaxJobs() {
        return maxJobs;
    }

    public void setMaxJobs(int maxJobs) {
        this.maxJobs = maxJobs;
    }

    public Process getProcess() {
        return process;
    }

    public boolean isShowNoVulnsMsg() {
        return showNoVulnsMsg;
    }

    public void setShowNoVulnsMsg(boolean showNoVulnsMsg) {
        this.showNoVulnsMsg = showNoVulnsMsg;
    }

    public boolean isPureBomNoVulns() {
        return pureBomNoVulns;
    }

    public void setPureBomNoVulns(boolean pureBomNoVulns) {
        this.pureBomNoVulns = pureBomNoVulns;
    }

    public boolean isShowComponents() {
        return showComponents;
    }

    public void setShowComponents(boolean showComponents) {
        this.showComponents = showComponents;
    }

    public String getReportTitle() {
        return reportTitle;
    }

    public void setReportTitle(String reportTitle) {
        this.reportTitle = reportTitle;
    }

    public String getPdfMetaName() {
        return pdfMetaName;
    }

    public void setPdfMetaName(String pdfMetaName) {
        this.pdfMetaName = pdfMetaName;
    }
}
