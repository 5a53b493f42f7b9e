package com.example.vexreport.domain.model;

/**
 * Named, optionally versioned element of a document: a component, a tool or a service.
 */
public record BomComponent(
        String bomRef,
        String name,
        String version
) {
}
