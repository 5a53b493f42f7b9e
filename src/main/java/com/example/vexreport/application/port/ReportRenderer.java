package com.example.vexreport.application.port;

import com.example.vexreport.domain.model.BomDocument;
import com.example.vexreport.domain.model.ConversionSettings;

import java.nio.file.Path;

/**
 * Writes a formatted report for a parsed document.
 */
public interface ReportRenderer {

	/**
	 * Renders {@code document} into a file at {@code destination}, replacing any existing file.
	 *
	 * @param document    parsed document
	 * @param settings    run settings controlling titles and optional sections
	 * @param destination target file
	 * @throws com.example.vexreport.infrastructure.exception.ReportRenderingException when the report cannot be written
	 */
    void render(BomDocument document, ConversionSettings settings, Path destination);
}
