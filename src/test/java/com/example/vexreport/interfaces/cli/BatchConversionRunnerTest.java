package com.example.vexreport.interfaces.cli;

import com.example.vexreport.application.service.BatchConversionService;
import com.example.vexreport.domain.model.ConversionSettings;
import com.example.vexreport.domain.model.ConversionSummary;
import com.example.vexreport.infrastructure.config.ReportProperties;
import com.example.vexreport.infrastructure.exception.InputScanException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the command-line adapter and its exit codes.
 */
class BatchConversionRunnerTest {

    @TempDir
    Path tempDir;

    private final BatchConversionService batchService = mock(BatchConversionService.class);
    private final ReportProperties properties = new ReportProperties();

    /**
     * The first positional argument replaces the configured input; options are left to Spring.
     */
    @Test
    void positionalArgumentOverridesInput() throws IOException {
        Path vex = Files.writeString(tempDir.resolve("vex.json"), "{}");
        properties.setInput(tempDir.resolve("elsewhere").toString());
        when(batchService.run(any())).thenReturn(new ConversionSummary(1, 1, 0, 0));
        BatchConversionRunner runner = new BatchConversionRunner(properties, batchService);

        runner.run(new DefaultApplicationArguments("--vexreport.max-jobs=2", vex.toString()));

        ArgumentCaptor<ConversionSettings> settings = ArgumentCaptor.forClass(ConversionSettings.class);
        verify(batchService).run(settings.capture());
        assertThat(settings.getValue().workingPath()).isEqualTo(vex);
        assertThat(runner.getExitCode()).isZero();
    }

    /**
     * Per-file failures do not change the exit code of a completed batch.
     */
    @Test
    void completedBatchWithFailuresExitsZero() {
        properties.setInput(tempDir.toString());
        when(batchService.run(any())).thenReturn(new ConversionSummary(3, 1, 1, 1));
        BatchConversionRunner runner = new BatchConversionRunner(properties, batchService);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    void fatalFailureExitsOne() {
        properties.setInput(tempDir.toString());
        when(batchService.run(any())).thenThrow(new InputScanException("cannot list", null));
        BatchConversionRunner runner = new BatchConversionRunner(properties, batchService);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    void invalidSettingsExitOneWithoutRunning() {
        properties.setInput(tempDir.toString());
        properties.setMaxJobs(300);
        BatchConversionRunner runner = new BatchConversionRunner(properties, batchService);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(1);
        verify(batchService, never()).run(any());
    }

    @Test
    void versionFallsBackOutsideAPackagedJar() {
        assertThat(BatchConversionRunner.version()).isNotBlank();
    }
}
