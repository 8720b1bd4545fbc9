package fr.lapetina.ensemble.orchestrator.dispatch;

import fr.lapetina.ensemble.orchestrator.domain.model.FailureType;

import java.time.Duration;
import java.util.Map;

/**
 * Summary of a completed ensemble.
 *
 * @param nodeCount      workers started, one per allocated node
 * @param generated      work items enqueued
 * @param skipped        grid points skipped because their directory existed
 * @param succeeded      runs that exited with status 0
 * @param failed         runs that failed at any step
 * @param tokensConsumed    termination tokens taken by workers
 * @param terminatedWorkers workers that reached the TERMINATED state
 * @param failuresByType failed runs per failure type
 * @param elapsed        wall time of the whole ensemble
 */
public record EnsembleReport(
        int nodeCount,
        int generated,
        int skipped,
        long succeeded,
        long failed,
        int tokensConsumed,
        int terminatedWorkers,
        Map<FailureType, Long> failuresByType,
        Duration elapsed
) {
    public EnsembleReport {
        failuresByType = failuresByType != null ? Map.copyOf(failuresByType) : Map.of();
    }

    /**
     * Runs that reached a final outcome.
     */
    public long processed() {
        return succeeded + failed;
    }
}
