package com.example.vexreport.infrastructure.cyclonedx;

import com.example.vexreport.application.port.BomDocumentParser;
import com.example.vexreport.domain.model.BomDocument;
import com.example.vexreport.domain.model.InputFileType;
import com.example.vexreport.infrastructure.exception.BomParseException;

import org.cyclonedx.exception.ParseException;
import org.cyclonedx.parsers.JsonParser;
import org.springframework.stereotype.Service;

/**
 * Parses CycloneDX JSON documents with the CycloneDX core library.
 */
@Service
public class CycloneDxJsonParser implements BomDocumentParser {

    private final CycloneDxBomMapper mapper;

    public CycloneDxJsonParser(CycloneDxBomMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public InputFileType supportedType() {
        return InputFileType.JSON;
    }

    @Override
    public BomDocument parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new BomParseException("JSON document is empty.", null);
        }
        try {
            return mapper.toDocument(new JsonParser().parse(content));
        } catch (ParseException ex) {
            throw new BomParseException("Unable to parse CycloneDX JSON document: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw new BomParseException("Malformed CycloneDX JSON document: " + ex.getMessage(), ex);
        }
    }
}
