package fr.lapetina.ensemble.orchestrator.domain.launch;

import java.util.List;

/**
 * Slurm launcher: {@code rankCount} tasks confined to a single node.
 */
public final class SrunLaunchStrategy implements LaunchStrategy {

    @Override
    public String getName() {
        return "srun";
    }

    @Override
    public List<String> prefix(int rankCount) {
        return List.of("srun", "-n", String.valueOf(rankCount), "-N", "1");
    }
}
