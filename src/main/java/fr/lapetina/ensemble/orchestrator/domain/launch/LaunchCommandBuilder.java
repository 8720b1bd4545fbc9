package fr.lapetina.ensemble.orchestrator.domain.launch;

import fr.lapetina.ensemble.orchestrator.infrastructure.environment.SchedulerEnvironment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the command line that launches one simulation run on one full node.
 *
 * With the {@code auto} launcher the choice follows the environment: {@code srun}
 * when a cluster scheduler is present, {@code mpirun} otherwise. Any other launcher
 * name pins the strategy. Building a command only reads the environment.
 */
public final class LaunchCommandBuilder {

    public static final String AUTO = "auto";
    public static final String SETTINGS_FILE = "settings-files.json";

    private final SchedulerEnvironment environment;
    private final LaunchStrategy pinnedStrategy;
    private final LaunchStrategy clusterStrategy = new SrunLaunchStrategy();
    private final LaunchStrategy localStrategy = new MpirunLaunchStrategy();

    /**
     * @param environment  scheduler environment consulted for the {@code auto} launcher
     * @param launcherName {@code auto} or the name of a registered {@link LaunchStrategy}
     * @throws IllegalArgumentException if the launcher name is unknown
     */
    public LaunchCommandBuilder(SchedulerEnvironment environment, String launcherName) {
        this.environment = Objects.requireNonNull(environment, "SchedulerEnvironment is required");
        if (launcherName == null || AUTO.equalsIgnoreCase(launcherName)) {
            this.pinnedStrategy = null;
        } else {
            this.pinnedStrategy = LaunchStrategyFactory.create(launcherName)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown launcher: " + launcherName));
        }
    }

    public LaunchCommandBuilder(SchedulerEnvironment environment) {
        this(environment, AUTO);
    }

    /**
     * Returns the strategy used for a given scheduler presence.
     */
    public LaunchStrategy selectStrategy(boolean hasClusterScheduler) {
        if (pinnedStrategy != null) {
            return pinnedStrategy;
        }
        return hasClusterScheduler ? clusterStrategy : localStrategy;
    }

    /**
     * Returns the launcher part of the command: executable plus arguments.
     *
     * @param rankCount           processes to request, normally the node's CPU count
     * @param hasClusterScheduler whether a cluster scheduler manages this job
     */
    public List<String> buildLaunchCommand(int rankCount, boolean hasClusterScheduler) {
        if (rankCount < 1) {
            throw new IllegalArgumentException("Rank count must be at least 1: " + rankCount);
        }
        return selectStrategy(hasClusterScheduler).prefix(rankCount);
    }

    /**
     * Returns the full command for one run, sized to every processor visible to the caller:
     * launcher prefix, simulation executable, then the settings file name.
     */
    public List<String> buildRunCommand(String executable) {
        List<String> command = new ArrayList<>(buildLaunchCommand(
                environment.availableProcessors(),
                environment.hasClusterScheduler()
        ));
        command.add(executable);
        command.add(SETTINGS_FILE);
        return command;
    }

    /**
     * Name of the launcher that {@link #buildRunCommand} currently resolves to.
     */
    public String describe() {
        return selectStrategy(environment.hasClusterScheduler()).getName();
    }
}
