package com.example.vexreport.application.service;

import com.example.vexreport.application.exception.ApplicationException;
import com.example.vexreport.domain.exception.DomainException;
import com.example.vexreport.domain.model.ConversionSettings;
import com.example.vexreport.domain.model.ConversionSummary;
import com.example.vexreport.domain.model.FileIdentity;
import com.example.vexreport.domain.model.PendingFiles;
import com.example.vexreport.infrastructure.exception.InfrastructureException;
import com.example.vexreport.infrastructure.concurrency.JobDispatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Application-layer service running a whole batch: discovery, one conversion job per pending file on the
 * dispatcher, then the final summary.
 */
@Service
public class BatchConversionService {

    private static final Logger log = LoggerFactory.getLogger(BatchConversionService.class);

    private final FileDiscoveryService discoveryService;
    private final DocumentConversionService conversionService;

    public BatchConversionService(FileDiscoveryService discoveryService, DocumentConversionService conversionService) {
        this.discoveryService = discoveryService;
        this.conversionService = conversionService;
    }

	/**
	 * Converts every file found under the configured working path.
	 * Returns once every submitted job has finished.
	 *
	 * @param settings run settings
	 * @return per-outcome counters
	 * @throws DomainException when the working path is a single file that is rejected
	 * @throws com.example.vexreport.infrastructure.exception.InputScanException   when the working directory cannot be listed
	 * @throws com.example.vexreport.infrastructure.exception.JobDispatchException when the processor count is unknown or a job is rejected
	 */
    public ConversionSummary run(ConversionSettings settings) {
        PendingFiles pending = discoveryService.discover(settings.workingPath(), settings.ignoredTypes());
        if (pending.isEmpty()) {
            return logSummary(ConversionSummary.empty());
        }

        int discovered = pending.count();
        ConversionTally tally = new ConversionTally();
        try (JobDispatcher dispatcher = new JobDispatcher(settings.maxJobs())) {
            log.info("{}", dispatcher);
            for (FileIdentity file : pending.drain()) {
                dispatcher.execute(() -> convertOne(file, settings, tally));
            }
        }

        return logSummary(tally.snapshot(discovered));
    }

    private ConversionSummary logSummary(ConversionSummary summary) {
        log.info("Processed {} files ({} generated, {} rendering failures, {} failures)",
                summary.discovered(), summary.generated(), summary.renderingFailed(), summary.failed());
        return summary;
    }

    private void convertOne(FileIdentity file, ConversionSettings settings, ConversionTally tally) {
        try {
            tally.record(conversionService.convert(file, settings));
        } catch (DomainException | ApplicationException | InfrastructureException ex) {
            log.error("Failed to convert {}: {}", file.path(), ex.getMessage());
            tally.recordFailure();
        } catch (RuntimeException ex) {
            // same handling in both dispatcher modes, the worker never sees it
            log.error("Unexpected error while converting {}", file.path(), ex);
            tally.recordFailure();
        }
    }
}
