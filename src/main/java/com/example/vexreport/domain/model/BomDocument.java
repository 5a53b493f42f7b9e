package com.example.vexreport.domain.model;

import java.util.List;

/**
 * Domain DTO holding the parts of a CycloneDX document that end up in a report.
 * Produced by the document parsers and consumed by the report renderer.
 */
public record BomDocument(
        String specVersion,
        int version,
        String serialNumber,
        BomMetadata metadata,
        List<BomComponent> components,
        List<BomVulnerability> vulnerabilities
) {
    public BomDocument {
        components = components == null ? List.of() : List.copyOf(components);
        vulnerabilities = vulnerabilities == null ? List.of() : List.copyOf(vulnerabilities);
    }

    public boolean hasVulnerabilities() {
        return !vulnerabilities.isEmpty();
    }
}
