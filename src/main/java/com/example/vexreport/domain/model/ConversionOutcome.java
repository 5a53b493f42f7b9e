package com.example.vexreport.domain.model;

/**
 * Result of converting one parsed document. Rendering failures are logged and do not fail the job.
 */
public enum ConversionOutcome {
    GENERATED,
    RENDERING_FAILED
}
