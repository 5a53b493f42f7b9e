package com.example.vexreport.domain.model;

import java.util.List;

/**
 * One reported vulnerability with its ratings and the bom-refs of the affected components.
 */
public record BomVulnerability(
        String id,
        String sourceName,
        String description,
        String detail,
        List<VulnerabilityRating> ratings,
        List<String> affectedRefs
) {
    public BomVulnerability {
        ratings = ratings == null ? List.of() : List.copyOf(ratings);
        affectedRefs = affectedRefs == null ? List.of() : List.copyOf(affectedRefs);
    }
}
