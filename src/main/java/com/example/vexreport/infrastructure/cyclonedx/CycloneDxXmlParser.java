package com.example.vexreport.infrastructure.cyclonedx;

import com.example.vexreport.application.port.BomDocumentParser;
import com.example.vexreport.domain.model.BomDocument;
import com.example.vexreport.domain.model.InputFileType;
import com.example.vexreport.infrastructure.exception.BomParseException;

import org.cyclonedx.exception.ParseException;
import org.cyclonedx.parsers.XmlParser;
import org.springframework.stereotype.Service;

/**
 * Parses CycloneDX XML documents with the CycloneDX core library.
 */
@Service
public class CycloneDxXmlParser implements BomDocumentParser {

    private final CycloneDxBomMapper mapper;

    public CycloneDxXmlParser(CycloneDxBomMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public InputFileType supportedType() {
        return InputFileType.XML;
    }

    @Override
    public BomDocument parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new BomParseException("XML document is empty.", null);
        }
        try {
            return mapper.toDocument(new XmlParser().parse(content));
        } catch (ParseException ex) {
            throw new BomParseException("Unable to parse CycloneDX XML document: " + ex.getMessage(), ex);
        } catch (RuntimeException ex) {
            throw new BomParseException("Malformed CycloneDX XML document: " + ex.getMessage(), ex);
        }
    }
}
