package fr.lapetina.ensemble.orchestrator.domain.launch;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Resolves the {@code launcher} setting to a launch strategy.
 *
 * Known launchers: {@code srun} (Slurm, one node per run), {@code mpirun} (local MPI)
 * and {@code direct} (no MPI wrapper). Names are case-insensitive.
 */
public final class LaunchStrategyFactory {

    private static final Map<String, Supplier<LaunchStrategy>> LAUNCHERS = Map.of(
            "srun", SrunLaunchStrategy::new,
            "mpirun", MpirunLaunchStrategy::new,
            "direct", DirectLaunchStrategy::new
    );

    private LaunchStrategyFactory() {
    }

    /**
     * Returns the strategy for a launcher name, or empty if no launcher has that name.
     */
    public static Optional<LaunchStrategy> create(String name) {
        Supplier<LaunchStrategy> supplier = LAUNCHERS.get(normalize(name));
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    public static boolean isRegistered(String name) {
        return LAUNCHERS.containsKey(normalize(name));
    }

    /**
     * Launcher names accepted in the startup configuration, besides {@code auto}.
     */
    public static Set<String> getRegisteredNames() {
        return LAUNCHERS.keySet();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
