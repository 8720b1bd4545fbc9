package fr.lapetina.ensemble.orchestrator.infrastructure.metrics;

import fr.lapetina.ensemble.orchestrator.domain.model.FailureType;
import fr.lapetina.ensemble.orchestrator.domain.model.RunOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private final MetricsRegistry metrics = new MetricsRegistry("ensemble");

    @TempDir
    Path dir;

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should count outcomes by status and failure type")
    void shouldCountOutcomes() {
        Path runDir = dir.resolve("F_0.01-k_0.05");
        metrics.recordOutcome(RunOutcome.succeeded(runDir, Duration.ofSeconds(3), "worker-0"));
        metrics.recordOutcome(RunOutcome.failed(runDir, FailureType.EXTERNAL_PROCESS_FAILURE, 2,
                "Run failed with 2", Duration.ofSeconds(1), "worker-1"));
        metrics.recordOutcome(RunOutcome.failed(runDir, FailureType.EXTERNAL_PROCESS_FAILURE, 9,
                "Run failed with 9", Duration.ofSeconds(1), "worker-1"));

        assertThat(metrics.getRegistry().get("ensemble_runs")
                .tags("status", "SUCCEEDED", "failure", "NONE").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("ensemble_runs")
                .tags("status", "FAILED", "failure", "EXTERNAL_PROCESS_FAILURE").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("ensemble_run_duration").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("should track busy workers and queue depth")
    void shouldTrackGauges() {
        AtomicInteger depth = new AtomicInteger(7);
        metrics.registerQueueDepth(depth::get);
        metrics.workerBusy();
        metrics.workerBusy();
        metrics.workerIdle();

        assertThat(metrics.getRegistry().get("ensemble_busy_workers").gauge().value()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("ensemble_queue_depth").gauge().value()).isEqualTo(7.0);
    }

    @Test
    @DisplayName("should expose generated and skipped counters in the scrape output")
    void shouldScrapeCounters() {
        metrics.incrementGenerated();
        metrics.incrementGenerated();
        metrics.incrementSkipped(3);

        String scrape = metrics.scrape();

        assertThat(scrape)
                .contains("ensemble_runs_generated_total 2.0")
                .contains("ensemble_runs_skipped_total 3.0")
                .contains("jvm_memory_used_bytes");
    }

    @Test
    @DisplayName("should write the scrape output to a file, creating parents")
    void shouldWriteToFile() throws IOException {
        metrics.incrementGenerated();
        Path file = dir.resolve("reports").resolve("metrics.prom");

        metrics.writeTo(file);

        assertThat(file).exists();
        assertThat(Files.readString(file)).contains("ensemble_runs_generated_total");
    }
}
