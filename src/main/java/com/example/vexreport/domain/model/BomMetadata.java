package com.example.vexreport.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Document-level metadata: creation time, generating tools and the subject component.
 */
public record BomMetadata(
        Instant timestamp,
        List<BomComponent> tools,
        BomComponent component
) {
    public BomMetadata {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
