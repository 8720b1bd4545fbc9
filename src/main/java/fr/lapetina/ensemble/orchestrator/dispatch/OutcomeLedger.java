package fr.lapetina.ensemble.orchestrator.dispatch;

import fr.lapetina.ensemble.orchestrator.domain.model.FailureType;
import fr.lapetina.ensemble.orchestrator.domain.model.RunOutcome;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-wide record of every finished run.
 * Thread-safe; workers append concurrently.
 */
public final class OutcomeLedger {

    private final ConcurrentLinkedQueue<RunOutcome> outcomes = new ConcurrentLinkedQueue<>();

    public void record(RunOutcome outcome) {
        outcomes.add(outcome);
    }

    /**
     * Returns a copy of the outcomes recorded so far, in completion order.
     */
    public List<RunOutcome> getOutcomes() {
        return new ArrayList<>(outcomes);
    }

    public int size() {
        return outcomes.size();
    }

    public long getSucceededCount() {
        return outcomes.stream().filter(RunOutcome::isSuccess).count();
    }

    public long getFailedCount() {
        return outcomes.stream().filter(RunOutcome::isFailure).count();
    }

    /**
     * Returns the number of failed runs per failure type.
     */
    public Map<FailureType, Long> getFailuresByType() {
        Map<FailureType, Long> counts = new EnumMap<>(FailureType.class);
        for (RunOutcome outcome : outcomes) {
            if (outcome.isFailure()) {
                counts.merge(outcome.failureType(), 1L, Long::sum);
            }
        }
        return counts;
    }
}
