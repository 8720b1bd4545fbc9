package fr.lapetina.ensemble.orchestrator.domain.launch;

import java.util.List;

/**
 * Runs the simulation as a single plain process, ignoring the rank count.
 * Only chosen when configured explicitly; useful for smoke runs of serial builds.
 */
public final class DirectLaunchStrategy implements LaunchStrategy {

    @Override
    public String getName() {
        return "direct";
    }

    @Override
    public List<String> prefix(int rankCount) {
        return List.of();
    }
}
