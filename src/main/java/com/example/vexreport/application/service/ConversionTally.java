package com.example.vexreport.application.service;

import com.example.vexreport.domain.model.ConversionOutcome;
import com.example.vexreport.domain.model.ConversionSummary;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe outcome counters shared by every job of one batch run.
 */
public class ConversionTally {

    private final AtomicInteger generated = new AtomicInteger();
    private final AtomicInteger renderingFailed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    public void record(ConversionOutcome outcome) {
        switch (outcome) {
            case GENERATED -> generated.incrementAndGet();
            case RENDERING_FAILED -> renderingFailed.incrementAndGet();
        }
    }

    public void recordFailure() {
        failed.incrementAndGet();
    }

	/**
	 * Freezes the current counters.
	 *
	 * @param discovered number of files submitted for conversion
	 * @return summary of the run so far
	 */
    public ConversionSummary snapshot(int discovered) {
        return new ConversionSummary(discovered, generated.get(), renderingFailed.get(), failed.get());
    }
}
