package fr.lapetina.ensemble.orchestrator.dispatch;

import fr.lapetina.ensemble.orchestrator.domain.model.RunConfig;
import fr.lapetina.ensemble.orchestrator.domain.sweep.RunDescriptorGenerator;
import fr.lapetina.ensemble.orchestrator.domain.sweep.SweepEnumeration;
import fr.lapetina.ensemble.orchestrator.infrastructure.config.JobSettings;
import fr.lapetina.ensemble.orchestrator.infrastructure.environment.SchedulerEnvironment;
import fr.lapetina.ensemble.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ensemble.orchestrator.infrastructure.process.RunExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a whole ensemble on a pool of one worker per allocated node.
 *
 * Lifecycle of {@link #run}:
 * 1. resolve the node count from the scheduler environment
 * 2. start that many workers, all blocking on the work queue
 * 3. enumerate the sweep and enqueue every work item
 * 4. enqueue one termination token per worker, only after all real work
 * 5. wait for every worker to exit
 *
 * Because tokens follow the last work item, no worker stops while work is unclaimed.
 */
public final class WorkerPoolSupervisor {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolSupervisor.class);

    private static final long PROGRESS_INTERVAL_SECONDS = 60;

    private final SchedulerEnvironment environment;
    private final WorkQueue queue;
    private final RunExecutor executor;
    private final RunDescriptorGenerator generator;
    private final OutcomeLedger ledger;
    private final MetricsRegistry metrics;

    private volatile List<EnsembleWorker> workers = List.of();

    public WorkerPoolSupervisor(
            SchedulerEnvironment environment,
            WorkQueue queue,
            RunExecutor executor,
            RunDescriptorGenerator generator,
            OutcomeLedger ledger,
            MetricsRegistry metrics
    ) {
        this.environment = environment;
        this.queue = queue;
        this.executor = executor;
        this.generator = generator;
        this.ledger = ledger;
        this.metrics = metrics;
    }

    /**
     * Runs the ensemble to completion.
     *
     * Failed runs never stop the ensemble. A failure of the generator itself is rethrown,
     * but only after the workers have drained what was enqueued and exited.
     *
     * @param settings job settings
     * @param template parameter template for every run
     * @return summary of the ensemble
     * @throws IllegalStateException if the scheduler reports an unusable node count
     * @throws InterruptedException  if interrupted while waiting; running simulations are stopped
     */
    public EnsembleReport run(JobSettings settings, RunConfig template) throws InterruptedException {
        Instant start = Instant.now();
        int nodeCount = environment.nodeCount();

        ExecutorService pool = Executors.newFixedThreadPool(nodeCount, new WorkerThreadFactory("ensemble-worker"));
        List<EnsembleWorker> started = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            EnsembleWorker worker = new EnsembleWorker(
                    "worker-" + i, queue, executor, settings, ledger, metrics);
            started.add(worker);
            pool.execute(worker);
        }
        workers = List.copyOf(started);
        log.info("Started {} workers", started.size());

        SweepEnumeration sweep = null;
        RuntimeException generationFailure = null;
        try {
            sweep = generator.generate(template, settings.getSweep(), settings.getEnsembleRoot());
            while (sweep.hasNext()) {
                queue.push(sweep.next());
                metrics.incrementGenerated();
            }
        } catch (RuntimeException e) {
            generationFailure = e;
            log.error("Sweep generation failed after {} runs", sweep != null ? sweep.getGeneratedCount() : 0, e);
        } finally {
            if (sweep != null) {
                metrics.incrementSkipped(sweep.getSkippedCount());
            }
            for (int i = 0; i < nodeCount; i++) {
                queue.pushTermination();
            }
        }
        int generated = sweep != null ? sweep.getGeneratedCount() : 0;
        int skipped = sweep != null ? sweep.getSkippedCount() : 0;
        log.info("Orchestrator created {} runs, skipped {}", generated, skipped);

        awaitWorkers(pool);

        if (generationFailure != null) {
            throw generationFailure;
        }

        int tokensConsumed = (int) started.stream().filter(EnsembleWorker::hasReceivedTermination).count();
        int terminatedWorkers = 0;
        for (EnsembleWorker worker : started) {
            if (worker.getState() == WorkerState.TERMINATED) {
                terminatedWorkers++;
            } else {
                log.warn("Worker did not terminate: workerId={}, state={}", worker.getId(), worker.getState());
            }
            log.debug("Worker summary: workerId={}, processed={}", worker.getId(), worker.getProcessedCount());
        }
        EnsembleReport report = new EnsembleReport(
                nodeCount,
                generated,
                skipped,
                ledger.getSucceededCount(),
                ledger.getFailedCount(),
                tokensConsumed,
                terminatedWorkers,
                ledger.getFailuresByType(),
                Duration.between(start, Instant.now())
        );
        log.info("Ensemble finished: nodes={}, generated={}, skipped={}, succeeded={}, failed={}, elapsedMs={}",
                report.nodeCount(), report.generated(), report.skipped(),
                report.succeeded(), report.failed(), report.elapsed().toMillis());
        return report;
    }

    /**
     * Workers of the latest {@link #run}, empty before the first one.
     */
    public List<EnsembleWorker> getWorkers() {
        return workers;
    }

    private void awaitWorkers(ExecutorService pool) throws InterruptedException {
        pool.shutdown();
        try {
            // No overall timeout: a hung simulation keeps its worker, and the ensemble, waiting
            while (!pool.awaitTermination(PROGRESS_INTERVAL_SECONDS, TimeUnit.SECONDS)) {
                log.info("Waiting for workers: finished={}, queueDepth={}", ledger.size(), queue.size());
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for workers, stopping them");
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    /**
     * Thread factory for worker threads. Non-daemon, so the JVM waits for running simulations.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(false);
            return t;
        }
    }
}
