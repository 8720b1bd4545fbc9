package fr.lapetina.ensemble.orchestrator;

import fr.lapetina.ensemble.orchestrator.dispatch.EnsembleReport;
import fr.lapetina.ensemble.orchestrator.domain.model.RunConfig;
import fr.lapetina.ensemble.orchestrator.infrastructure.config.JobSettings;
import fr.lapetina.ensemble.orchestrator.infrastructure.config.JobSettingsLoader;
import fr.lapetina.ensemble.orchestrator.infrastructure.config.JobSettingsLoader.ConfigValidationException;
import fr.lapetina.ensemble.orchestrator.infrastructure.environment.SchedulerEnvironment;
import fr.lapetina.ensemble.orchestrator.infrastructure.environment.SlurmEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Main entry point for the ensemble orchestrator.
 *
 * Takes exactly one argument, the startup settings file. Exits non-zero only on a usage
 * error, invalid settings or an internal fault; failed simulation runs do not affect
 * the exit code.
 */
public class EnsembleOrchestratorApplication {

    private static final Logger log = LoggerFactory.getLogger(EnsembleOrchestratorApplication.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final SchedulerEnvironment environment;
    private final JobSettingsLoader settingsLoader;

    public EnsembleOrchestratorApplication(SchedulerEnvironment environment, JobSettingsLoader settingsLoader) {
        this.environment = environment;
        this.settingsLoader = settingsLoader;
    }

    /**
     * Runs the orchestrator and returns the process exit code.
     */
    public int run(String[] args) {
        if (args.length != 1) {
            log.error("Usage: ensemble-orchestrator <settings.json> - provide a settings file that points "
                    + "to the simulation executable and its input files (got {} arguments)", args.length);
            return EXIT_USAGE;
        }

        try {
            runEnsemble(Path.of(args[0]));
            log.info("DONE");
            return EXIT_OK;
        } catch (ConfigValidationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Orchestrator interrupted");
            return EXIT_FAILURE;
        } catch (Exception e) {
            log.error("Orchestrator failed", e);
            return EXIT_FAILURE;
        }
    }

    /**
     * Validates the settings, then runs the whole ensemble.
     *
     * @throws ConfigValidationException if the settings or the template are invalid
     * @throws InterruptedException      if interrupted while waiting for workers
     */
    public EnsembleReport runEnsemble(Path settingsPath) throws InterruptedException {
        JobSettings settings = settingsLoader.load(settingsPath);
        RunConfig template = settingsLoader.loadTemplate(settings);

        try (OrchestratorFactory factory = OrchestratorFactory.create(settings, environment)) {
            EnsembleReport report = factory.getSupervisor().run(settings, template);
            factory.exportMetrics();
            return report;
        }
    }

    public static void main(String[] args) {
        EnsembleOrchestratorApplication app = new EnsembleOrchestratorApplication(
                SlurmEnvironment.fromSystem(),
                new JobSettingsLoader()
        );
        System.exit(app.run(args));
    }
}
