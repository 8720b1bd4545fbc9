package fr.lapetina.ensemble.orchestrator.domain.launch;

import java.util.List;

/**
 * Generic MPI launcher for machines without a cluster scheduler. No node affinity.
 */
public final class MpirunLaunchStrategy implements LaunchStrategy {

    @Override
    public String getName() {
        return "mpirun";
    }

    @Override
    public List<String> prefix(int rankCount) {
        return List.of("mpirun", "-np", String.valueOf(rankCount));
    }
}
