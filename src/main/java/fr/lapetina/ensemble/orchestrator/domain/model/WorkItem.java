package fr.lapetina.ensemble.orchestrator.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One run of the ensemble: the directory it owns and the configuration it runs with.
 * Created by the generator, consumed exactly once by exactly one worker.
 */
public record WorkItem(Path directory, RunConfig config) implements QueueEntry {

    public WorkItem {
        Objects.requireNonNull(directory, "Run directory is required");
        Objects.requireNonNull(config, "Run config is required");
    }

    /**
     * Directory name relative to the ensemble root, e.g. {@code F_0.01-k_0.05}.
     */
    public String name() {
        return directory.getFileName().toString();
    }
}
