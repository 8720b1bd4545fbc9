package fr.lapetina.ensemble.orchestrator.infrastructure.metrics;

import fr.lapetina.ensemble.orchestrator.domain.model.RunOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Generated and skipped run counters
 * - Run outcome counters by status and failure type
 * - Run duration timer
 * - Queue depth and busy worker gauges
 * - JVM and system metrics
 * - Prometheus text exposition, optionally written to a file at the end of the ensemble
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final Counter generatedCounter;
    private final Counter skippedCounter;
    private final Timer runTimer;
    private final ConcurrentHashMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();

    private final AtomicInteger busyWorkers = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.generatedCounter = Counter.builder(prefix + "_runs_generated")
                .description("Runs enqueued by the sweep generator")
                .register(registry);

        this.skippedCounter = Counter.builder(prefix + "_runs_skipped")
                .description("Grid points skipped because their run directory exists")
                .register(registry);

        this.runTimer = Timer.builder(prefix + "_run_duration")
                .description("Wall time of a single run, staging included")
                .register(registry);

        Gauge.builder(prefix + "_busy_workers", busyWorkers, AtomicInteger::get)
                .description("Workers currently running a simulation")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ensemble");
    }

    public void incrementGenerated() {
        generatedCounter.increment();
    }

    public void incrementSkipped(int count) {
        skippedCounter.increment(count);
    }

    /**
     * Counts a finished run and records its duration.
     */
    public void recordOutcome(RunOutcome outcome) {
        String failure = outcome.failureType() != null ? outcome.failureType().name() : "NONE";
        String key = outcome.status().name() + ":" + failure;
        outcomeCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_runs")
                        .description("Finished runs")
                        .tag("status", outcome.status().name())
                        .tag("failure", failure)
                        .register(registry)
        ).increment();
        runTimer.record(outcome.duration());
    }

    /**
     * Registers a gauge for the work queue depth.
     */
    public void registerQueueDepth(Supplier<Number> depth) {
        Gauge.builder(prefix + "_queue_depth", depth, s -> s.get().doubleValue())
                .description("Entries waiting on the work queue")
                .strongReference(true)
                .register(registry);
    }

    public void workerBusy() {
        busyWorkers.incrementAndGet();
    }

    public void workerIdle() {
        busyWorkers.decrementAndGet();
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Writes the Prometheus scrape output to a file, replacing it.
     */
    public void writeTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, scrape(), StandardCharsets.UTF_8);
        log.info("Metrics written: file={}", file);
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
