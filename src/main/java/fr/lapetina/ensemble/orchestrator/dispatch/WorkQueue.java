package fr.lapetina.ensemble.orchestrator.dispatch;

import fr.lapetina.ensemble.orchestrator.domain.model.QueueEntry;
import fr.lapetina.ensemble.orchestrator.domain.model.TerminationToken;
import fr.lapetina.ensemble.orchestrator.domain.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO handoff between the sweep generator and the workers.
 *
 * Multi-producer, multi-consumer. Every entry, termination tokens included, is taken by
 * exactly one consumer. Which consumer gets which entry is unspecified.
 */
public final class WorkQueue {

    private static final Logger log = LoggerFactory.getLogger(WorkQueue.class);

    private final BlockingQueue<QueueEntry> entries = new LinkedBlockingQueue<>();

    /**
     * Enqueues a work item. Never blocks.
     */
    public void push(WorkItem item) {
        offer(Objects.requireNonNull(item, "Work item is required"));
        log.debug("Work item enqueued: runDir={}, depth={}", item.directory(), entries.size());
    }

    /**
     * Enqueues one termination token, which stops exactly one worker.
     */
    public void pushTermination() {
        offer(TerminationToken.INSTANCE);
        log.debug("Termination token enqueued: depth={}", entries.size());
    }

    /**
     * Takes the next entry, waiting until one is available.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public QueueEntry pop() throws InterruptedException {
        return entries.take();
    }

    /**
     * Returns the number of entries waiting.
     */
    public int size() {
        return entries.size();
    }

    private void offer(QueueEntry entry) {
        if (!entries.offer(entry)) {
            // Unbounded queue: offer only fails if capacity is exhausted
            throw new IllegalStateException("Work queue rejected entry: " + entry);
        }
    }
}
