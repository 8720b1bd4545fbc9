package fr.lapetina.ensemble.orchestrator.domain.model;

/**
 * Error taxonomy for individual runs.
 * Every type here is fatal to one work item only; none of them stops the ensemble.
 */
public enum FailureType {
    /** Run directory already existed when the executor tried to create it */
    DIRECTORY_CONFLICT,

    /** Run config could not be written as JSON */
    SERIALIZATION_ERROR,

    /** Auxiliary descriptor or simulation executable missing at use time */
    RESOURCE_UNAVAILABLE,

    /** Any other I/O failure while staging the run directory */
    IO_ERROR,

    /** Simulation exited with a non-zero status */
    EXTERNAL_PROCESS_FAILURE,

    /** Worker interrupted while waiting for the simulation */
    INTERRUPTED,

    /** Unexpected fault inside the worker */
    INTERNAL_ERROR
}
