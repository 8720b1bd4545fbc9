package fr.lapetina.ensemble.orchestrator.dispatch;

import fr.lapetina.ensemble.orchestrator.domain.model.FailureType;
import fr.lapetina.ensemble.orchestrator.domain.model.QueueEntry;
import fr.lapetina.ensemble.orchestrator.domain.model.RunOutcome;
import fr.lapetina.ensemble.orchestrator.domain.model.TerminationToken;
import fr.lapetina.ensemble.orchestrator.domain.model.WorkItem;
import fr.lapetina.ensemble.orchestrator.infrastructure.config.JobSettings;
import fr.lapetina.ensemble.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ensemble.orchestrator.infrastructure.process.RunExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One worker of the pool, standing for one allocated node.
 *
 * Loops IDLE -> RUNNING -> IDLE until it takes a termination token, then ends TERMINATED.
 * Runs one simulation at a time and waits for it, so each node carries at most one run.
 */
public final class EnsembleWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EnsembleWorker.class);

    private final String id;
    private final WorkQueue queue;
    private final RunExecutor executor;
    private final JobSettings settings;
    private final OutcomeLedger ledger;
    private final MetricsRegistry metrics;

    private final AtomicReference<WorkerState> state = new AtomicReference<>(WorkerState.IDLE);
    private final AtomicInteger processedCount = new AtomicInteger(0);
    private volatile boolean terminationReceived;

    public EnsembleWorker(
            String id,
            WorkQueue queue,
            RunExecutor executor,
            JobSettings settings,
            OutcomeLedger ledger,
            MetricsRegistry metrics
    ) {
        this.id = id;
        this.queue = queue;
        this.executor = executor;
        this.settings = settings;
        this.ledger = ledger;
        this.metrics = metrics;
    }

    @Override
    public void run() {
        log.info("Worker started: workerId={}, thread={}", id, Thread.currentThread().getName());
        try {
            while (true) {
                QueueEntry entry = queue.pop();
                if (entry instanceof TerminationToken) {
                    terminationReceived = true;
                    break;
                }
                runItem((WorkItem) entry);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted: workerId={}, processed={}", id, processedCount.get());
        } finally {
            state.set(WorkerState.TERMINATED);
        }
        log.info("Worker terminated: workerId={}, processed={}", id, processedCount.get());
    }

    private void runItem(WorkItem item) {
        state.set(WorkerState.RUNNING);
        metrics.workerBusy();
        MDC.put("workerId", id);
        MDC.put("runDir", item.name());
        Instant start = Instant.now();
        RunOutcome outcome;
        try {
            outcome = executor.execute(item, settings, id);
        } catch (RuntimeException e) {
            log.error("Unexpected error running item: workerId={}, runDir={}", id, item.directory(), e);
            outcome = RunOutcome.failed(item.directory(), FailureType.INTERNAL_ERROR, null,
                    e.toString(), Duration.between(start, Instant.now()), id);
        } finally {
            MDC.remove("workerId");
            MDC.remove("runDir");
            metrics.workerIdle();
        }

        ledger.record(outcome);
        metrics.recordOutcome(outcome);
        processedCount.incrementAndGet();
        state.set(WorkerState.IDLE);
    }

    public String getId() {
        return id;
    }

    public WorkerState getState() {
        return state.get();
    }

    /**
     * Number of work items this worker has finished, successfully or not.
     */
    public int getProcessedCount() {
        return processedCount.get();
    }

    /**
     * Returns true if this worker stopped because it consumed a termination token.
     */
    public boolean hasReceivedTermination() {
        return terminationReceived;
    }
}
