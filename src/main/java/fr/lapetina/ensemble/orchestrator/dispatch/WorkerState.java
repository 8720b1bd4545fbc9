package fr.lapetina.ensemble.orchestrator.dispatch;

/**
 * Lifecycle state of an ensemble worker.
 */
public enum WorkerState {
    /** Waiting on the work queue */
    IDLE,

    /** Executing a work item */
    RUNNING,

    /** Received a termination token or was interrupted; will not take more work */
    TERMINATED
}
