package fr.lapetina.ensemble.orchestrator.domain.model;

/**
 * Anything that travels on the work queue: a {@link WorkItem} or the {@link TerminationToken}.
 */
public interface QueueEntry {
}
