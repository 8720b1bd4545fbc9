package fr.lapetina.ensemble.orchestrator.domain.model;

/**
 * Final status of a run.
 */
public enum RunStatus {
    SUCCEEDED,
    FAILED
}
