package fr.lapetina.ensemble.orchestrator.infrastructure.environment;

/**
 * Read-only view of the cluster scheduler the orchestrator runs under.
 *
 * Implementations must never mutate the process environment.
 */
public interface SchedulerEnvironment {

    /**
     * Returns true if a cluster scheduler is managing this job.
     */
    boolean hasClusterScheduler();

    /**
     * Returns the number of nodes allocated to this job, 1 when no scheduler says otherwise.
     *
     * @throws IllegalStateException if the scheduler reports an unusable node count
     */
    int nodeCount();

    /**
     * Returns the number of processing units visible to the calling worker.
     */
    default int availableProcessors() {
        return Runtime.getRuntime().availableProcessors();
    }
}
