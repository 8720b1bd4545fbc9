package fr.lapetina.ensemble.orchestrator.domain.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Result of executing one work item.
 * Immutable and thread-safe.
 *
 * @param runDirectory the run's private directory
 * @param status       final status
 * @param exitCode     simulation exit status, or null if no process was started
 * @param failureType  failure category, null on success
 * @param message      human-readable failure detail, null on success
 * @param stdout       captured standard output file
 * @param stderr       captured standard error file
 * @param duration     wall time spent on the item
 * @param workerId     worker that executed the item
 */
public record RunOutcome(
        Path runDirectory,
        RunStatus status,
        Integer exitCode,
        FailureType failureType,
        String message,
        Path stdout,
        Path stderr,
        Duration duration,
        String workerId
) {
    public static final String STDOUT_FILE = "stdout.txt";
    public static final String STDERR_FILE = "stderr.txt";

    public RunOutcome {
        Objects.requireNonNull(runDirectory, "Run directory is required");
        Objects.requireNonNull(status, "Status is required");
        if (status == RunStatus.FAILED && failureType == null) {
            failureType = FailureType.INTERNAL_ERROR;
        }
        if (duration == null) {
            duration = Duration.ZERO;
        }
    }

    /**
     * Creates a successful outcome.
     */
    public static RunOutcome succeeded(Path runDirectory, Duration duration, String workerId) {
        return new RunOutcome(
                runDirectory, RunStatus.SUCCEEDED, 0, null, null,
                runDirectory.resolve(STDOUT_FILE), runDirectory.resolve(STDERR_FILE),
                duration, workerId
        );
    }

    /**
     * Creates a failed outcome.
     *
     * @param exitCode simulation exit status, or null when the failure happened before launch
     */
    public static RunOutcome failed(
            Path runDirectory,
            FailureType failureType,
            Integer exitCode,
            String message,
            Duration duration,
            String workerId
    ) {
        return new RunOutcome(
                runDirectory, RunStatus.FAILED, exitCode, failureType, message,
                runDirectory.resolve(STDOUT_FILE), runDirectory.resolve(STDERR_FILE),
                duration, workerId
        );
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCEEDED;
    }

    public boolean isFailure() {
        return status == RunStatus.FAILED;
    }
}
