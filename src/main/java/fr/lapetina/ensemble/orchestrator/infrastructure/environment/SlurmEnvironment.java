package fr.lapetina.ensemble.orchestrator.infrastructure.environment;

import java.util.Map;

/**
 * Slurm-backed scheduler environment.
 *
 * Slurm is considered present when any variable of its namespace ({@code SLURM*}) is set.
 * The node count comes from {@code SLURM_JOB_NUM_NODES}.
 */
public final class SlurmEnvironment implements SchedulerEnvironment {

    public static final String VARIABLE_PREFIX = "SLURM";
    public static final String NODE_COUNT_VARIABLE = "SLURM_JOB_NUM_NODES";

    private final Map<String, String> variables;

    public SlurmEnvironment(Map<String, String> variables) {
        this.variables = Map.copyOf(variables);
    }

    /**
     * Creates an environment backed by the variables of the current process.
     */
    public static SlurmEnvironment fromSystem() {
        return new SlurmEnvironment(System.getenv());
    }

    @Override
    public boolean hasClusterScheduler() {
        return variables.keySet().stream().anyMatch(name -> name.startsWith(VARIABLE_PREFIX));
    }

    @Override
    public int nodeCount() {
        String value = variables.get(NODE_COUNT_VARIABLE);
        if (value == null || value.isBlank()) {
            return 1;
        }
        int count;
        try {
            count = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(NODE_COUNT_VARIABLE + " is not a number: " + value, e);
        }
        if (count < 1) {
            throw new IllegalStateException(NODE_COUNT_VARIABLE + " must be at least 1: " + value);
        }
        return count;
    }

    @Override
    public String toString() {
        return "SlurmEnvironment{" +
                "present=" + hasClusterScheduler() +
                ", " + NODE_COUNT_VARIABLE + "=" + variables.get(NODE_COUNT_VARIABLE) +
                '}';
    }
}
