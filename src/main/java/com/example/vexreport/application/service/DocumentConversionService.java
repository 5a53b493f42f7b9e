package com.example.vexreport.application.service;

import com.example.vexreport.application.port.BomDocumentParser;
import com.example.vexreport.application.port.ReportRenderer;
import com.example.vexreport.domain.exception.InvalidFileStemException;
import com.example.vexreport.domain.exception.InvalidOutputDirectoryException;
import com.example.vexreport.domain.exception.UnsupportedFileTypeException;
import com.example.vexreport.domain.model.BomDocument;
import com.example.vexreport.domain.model.ConversionOutcome;
import com.example.vexreport.domain.model.ConversionSettings;
import com.example.vexreport.domain.model.FileIdentity;
import com.example.vexreport.infrastructure.exception.BomParseException;
import com.example.vexreport.infrastructure.exception.ReportRenderingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Application-layer service converting one input file into one PDF report.
 * Parse and path failures are thrown to the caller; a rendering failure is only logged and reported as an outcome,
 * so one unreadable layout never counts as a failed job.
 */
@Service
public class DocumentConversionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentConversionService.class);

    private final BomParserRegistry parserRegistry;
    private final ReportRenderer reportRenderer;

    public DocumentConversionService(BomParserRegistry parserRegistry, ReportRenderer reportRenderer) {
        this.parserRegistry = parserRegistry;
        this.reportRenderer = reportRenderer;
    }

	/**
	 * Reads, parses and renders one file.
	 *
	 * @param file     pending file
	 * @param settings run settings
	 * @return {@link ConversionOutcome#GENERATED} or {@link ConversionOutcome#RENDERING_FAILED}
	 * @throws UnsupportedFileTypeException    when no parser handles the file type
	 * @throws BomParseException               when the file cannot be read or parsed
	 * @throws InvalidFileStemException        when the report name cannot be derived
	 * @throws InvalidOutputDirectoryException when the output directory is a regular file
	 */
    public ConversionOutcome convert(FileIdentity file, ConversionSettings settings) {
        log.info("Processing {}", file.path());
        BomDocumentParser parser = parserRegistry.parserFor(file);
        BomDocument document = parser.parse(readContent(file.path()));
        Path destination = ReportPathResolver.resolve(settings.outputDir(), file.path());

        try {
            reportRenderer.render(document, settings, destination);
        } catch (ReportRenderingException ex) {
            log.warn("Failed to generate PDF for {}: {}", file.path(), ex.getMessage());
            return ConversionOutcome.RENDERING_FAILED;
        }
        log.info("Successfully generated PDF: {}", destination);
        return ConversionOutcome.GENERATED;
    }

    private byte[] readContent(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new BomParseException("Unable to read " + path + ": " + ex.getMessage(), ex);
        }
    }
}
