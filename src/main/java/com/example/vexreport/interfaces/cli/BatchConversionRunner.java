package com.example.vexreport.interfaces.cli;

import com.example.vexreport.application.service.BatchConversionService;
import com.example.vexreport.domain.model.ConversionSettings;
import com.example.vexreport.infrastructure.config.ReportProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Command-line adapter: turns the bound properties and the optional positional input path into run settings,
 * runs the batch and exposes the exit code.
 * Any exception escaping the batch is logged and yields exit code 1; a completed batch exits 0 even when
 * individual files failed.
 */
@Component
@ConditionalOnProperty(prefix = "vexreport.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchConversionRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String PRODUCT_NAME = "vexreport";
    static final String PRODUCT_DESCRIPTION = "CycloneDX (VEX) to PDF Converter";

    private static final Logger log = LoggerFactory.getLogger(BatchConversionRunner.class);

    private final ReportProperties properties;
    private final BatchConversionService batchConversionService;
    private int exitCode;

    public BatchConversionRunner(ReportProperties properties, BatchConversionService batchConversionService) {
        this.properties = properties;
        this.batchConversionService = batchConversionService;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("{} {} - {}", PRODUCT_NAME, version(), PRODUCT_DESCRIPTION);
        List<String> positional = args.getNonOptionArgs();
        String inputOverride = positional.isEmpty() ? null : positional.get(0);
        try {
            ConversionSettings settings = properties.toSettings(inputOverride);
            batchConversionService.run(settings);
            exitCode = 0;
        } catch (RuntimeException ex) {
            log.error("Conversion aborted: {}", ex.getMessage(), ex);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static String version() {
        String version = BatchConversionRunner.class.getPackage().getImplementationVersion();
        return version != null ? version : "dev";
    }
}
