package fr.lapetina.ensemble.orchestrator.domain.launch;

import java.util.List;

/**
 * Strategy interface for turning a rank count into a node-parallel launcher invocation.
 *
 * Implementations must be stateless: they are shared by all workers.
 */
public interface LaunchStrategy {

    /**
     * Returns the name of this strategy for configuration and logging.
     */
    String getName();

    /**
     * Returns the launcher executable and its arguments, to be followed by the
     * simulation executable and its own arguments.
     *
     * @param rankCount number of processes to request, at least 1
     * @return launcher prefix, possibly empty
     */
    List<String> prefix(int rankCount);
}
