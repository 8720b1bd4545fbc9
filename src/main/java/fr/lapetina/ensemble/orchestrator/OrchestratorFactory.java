package fr.lapetina.ensemble.orchestrator;

import fr.lapetina.ensemble.orchestrator.dispatch.OutcomeLedger;
import fr.lapetina.ensemble.orchestrator.dispatch.WorkQueue;
import fr.lapetina.ensemble.orchestrator.dispatch.WorkerPoolSupervisor;
import fr.lapetina.ensemble.orchestrator.domain.launch.LaunchCommandBuilder;
import fr.lapetina.ensemble.orchestrator.domain.sweep.RunDescriptorGenerator;
import fr.lapetina.ensemble.orchestrator.infrastructure.config.JobSettings;
import fr.lapetina.ensemble.orchestrator.infrastructure.environment.SchedulerEnvironment;
import fr.lapetina.ensemble.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ensemble.orchestrator.infrastructure.process.RunExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Wires a fully configured orchestrator from validated job settings.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create(settings, SlurmEnvironment.fromSystem())) {
 *     EnsembleReport report = factory.getSupervisor().run(settings, template);
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final JobSettings settings;
    private final SchedulerEnvironment environment;
    private final MetricsRegistry metricsRegistry;
    private final WorkQueue workQueue;
    private final OutcomeLedger ledger;
    private final LaunchCommandBuilder launchCommandBuilder;
    private final RunExecutor runExecutor;
    private final WorkerPoolSupervisor supervisor;

    protected OrchestratorFactory(
            JobSettings settings,
            SchedulerEnvironment environment,
            RunExecutor runExecutorOverride
    ) {
        log.info("Initializing OrchestratorFactory: ensembleRoot={}", settings.getEnsembleRoot());

        this.settings = settings;
        this.environment = environment;
        this.metricsRegistry = new MetricsRegistry();
        this.workQueue = new WorkQueue();
        this.ledger = new OutcomeLedger();
        this.launchCommandBuilder = new LaunchCommandBuilder(environment, settings.getLauncher());

        // Null selects the process-launching executor
        this.runExecutor = runExecutorOverride != null
                ? runExecutorOverride
                : new RunExecutor(launchCommandBuilder);

        this.supervisor = new WorkerPoolSupervisor(
                environment,
                workQueue,
                runExecutor,
                new RunDescriptorGenerator(),
                ledger,
                metricsRegistry
        );

        metricsRegistry.registerQueueDepth(workQueue::size);

        log.info("OrchestratorFactory initialized: launcher={}, scheduler={}",
                launchCommandBuilder.describe(), environment);
    }

    /**
     * Creates a factory for the given settings and scheduler environment.
     */
    public static OrchestratorFactory create(JobSettings settings, SchedulerEnvironment environment) {
        return new OrchestratorFactory(settings, environment, null);
    }

    public WorkerPoolSupervisor getSupervisor() {
        return supervisor;
    }

    public OutcomeLedger getLedger() {
        return ledger;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public WorkQueue getWorkQueue() {
        return workQueue;
    }

    public LaunchCommandBuilder getLaunchCommandBuilder() {
        return launchCommandBuilder;
    }

    public RunExecutor getRunExecutor() {
        return runExecutor;
    }

    public SchedulerEnvironment getEnvironment() {
        return environment;
    }

    /**
     * Writes the metrics exposition to the configured metrics file, if any.
     * A write failure is logged and otherwise ignored: metrics never fail an ensemble.
     */
    public void exportMetrics() {
        Optional<Path> metricsFile = settings.getMetricsFile();
        if (metricsFile.isEmpty()) {
            return;
        }
        try {
            metricsRegistry.writeTo(metricsFile.get());
        } catch (IOException e) {
            log.warn("Failed to write metrics file: {}", metricsFile.get(), e);
        }
    }

    @Override
    public void close() {
        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }
        log.info("OrchestratorFactory shut down");
    }
}
