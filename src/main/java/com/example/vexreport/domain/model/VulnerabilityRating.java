package com.example.vexreport.domain.model;

/**
 * Severity rating of a vulnerability as published by one source.
 */
public record VulnerabilityRating(
        String severity,
        String score,
        String method,
        String sourceName
) {
}
