package fr.lapetina.ensemble.orchestrator.dispatch.exception;

import fr.lapetina.ensemble.orchestrator.domain.model.FailureType;

/**
 * Exception raised while executing a single run.
 *
 * Never escapes the run executor: it is turned into a failed outcome there, so one bad
 * grid point cannot stop a worker or the ensemble.
 */
public final class RunException extends Exception {

    private final FailureType failureType;
    private final Integer exitCode;

    public RunException(FailureType failureType, String message) {
        this(failureType, message, null, null);
    }

    public RunException(FailureType failureType, String message, Throwable cause) {
        this(failureType, message, null, cause);
    }

    public RunException(FailureType failureType, String message, Integer exitCode, Throwable cause) {
        super(failureType + ": " + message, cause);
        this.failureType = failureType;
        this.exitCode = exitCode;
    }

    /**
     * Creates the exception for a simulation that exited with a non-zero status.
     */
    public static RunException exitedWith(int exitCode) {
        return new RunException(FailureType.EXTERNAL_PROCESS_FAILURE,
                "Run failed with " + exitCode, exitCode, null);
    }

    public FailureType getFailureType() {
        return failureType;
    }

    /**
     * Exit status of the simulation, null if it never ran or did not finish.
     */
    public Integer getExitCode() {
        return exitCode;
    }
}
