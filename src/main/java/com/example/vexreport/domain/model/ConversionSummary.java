package com.example.vexreport.domain.model;

/**
 * Totals reported at the end of a batch run.
 *
 * @param discovered      files accepted by discovery (and submitted as jobs)
 * @param generated       reports written successfully
 * @param renderingFailed documents parsed but not rendered
 * @param failed          jobs that stopped before rendering (read, parse or path errors)
 */
public record ConversionSummary(
        int discovered,
        int generated,
        int renderingFailed,
        int failed
) {
    public static ConversionSummary empty() {
        return new ConversionSummary(0, 0, 0, 0);
    }

    public int attempted() {
        return generated + renderingFailed + failed;
    }
}
