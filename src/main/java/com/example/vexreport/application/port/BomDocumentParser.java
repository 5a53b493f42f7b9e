package com.example.vexreport.application.port;

import com.example.vexreport.domain.model.BomDocument;
import com.example.vexreport.domain.model.InputFileType;

/**
 * Turns the raw bytes of one input file into a {@link BomDocument}.
 * One implementation exists per supported {@link InputFileType}.
 */
public interface BomDocumentParser {

    /**
     * @return the file type this parser reads
     */
    InputFileType supportedType();

	/**
	 * Parses a complete document.
	 *
	 * @param content raw file content
	 * @return parsed document
	 * @throws com.example.vexreport.infrastructure.exception.BomParseException when the content is not a valid document
	 */
    BomDocument parse(byte[] content);
}
