package fr.lapetina.ensemble.orchestrator.domain.model;

/**
 * Sentinel telling the worker that dequeues it that no more work will arrive for it.
 */
public enum TerminationToken implements QueueEntry {
    INSTANCE
}
