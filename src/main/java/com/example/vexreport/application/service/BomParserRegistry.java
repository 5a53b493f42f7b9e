package com.example.vexreport.application.service;

import com.example.vexreport.application.port.BomDocumentParser;
import com.example.vexreport.domain.exception.UnsupportedFileTypeException;
import com.example.vexreport.domain.model.FileIdentity;
import com.example.vexreport.domain.model.InputFileType;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the document parser for a file type among every {@link BomDocumentParser} bean.
 */
@Service
public class BomParserRegistry {

    private final Map<InputFileType, BomDocumentParser> parsers = new EnumMap<>(InputFileType.class);

	/**
	 * @param parsers available parsers, at most one per type
	 * @throws IllegalStateException when two parsers claim the same type
	 */
    public BomParserRegistry(List<BomDocumentParser> parsers) {
        for (BomDocumentParser parser : parsers) {
            BomDocumentParser previous = this.parsers.put(parser.supportedType(), parser);
            if (previous != null) {
                throw new IllegalStateException("Two parsers registered for " + parser.supportedType());
            }
        }
    }

	/**
	 * Returns the parser for the file's type.
	 *
	 * @param file pending file
	 * @return matching parser
	 * @throws UnsupportedFileTypeException when no parser handles the type, including {@link InputFileType#UNSUPPORTED}
	 */
    public BomDocumentParser parserFor(FileIdentity file) {
        BomDocumentParser parser = parsers.get(file.type());
        if (parser == null) {
            throw new UnsupportedFileTypeException(file.path());
        }
        return parser;
    }
}
