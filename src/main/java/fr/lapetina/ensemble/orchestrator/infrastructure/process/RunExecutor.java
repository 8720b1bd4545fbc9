package fr.lapetina.ensemble.orchestrator.infrastructure.process;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import fr.lapetina.ensemble.orchestrator.dispatch.exception.RunException;
import fr.lapetina.ensemble.orchestrator.domain.launch.LaunchCommandBuilder;
import fr.lapetina.ensemble.orchestrator.domain.model.FailureType;
import fr.lapetina.ensemble.orchestrator.domain.model.RunOutcome;
import fr.lapetina.ensemble.orchestrator.domain.model.WorkItem;
import fr.lapetina.ensemble.orchestrator.infrastructure.config.JobSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Executes one work item: stages its run directory, then runs the simulation in it.
 *
 * Steps, each a distinct failure point:
 * 1. create the run directory (must not exist yet)
 * 2. write the run config as {@code settings-files.json}
 * 3. copy the auxiliary descriptor as {@code adios2.xml}
 * 4. launch the simulation with the run directory as working directory,
 *    stdout and stderr captured to files
 * 5. wait for it and record its exit status
 *
 * A failure at any step fails this item only and is returned as an outcome, never thrown.
 * There are no retries and no timeout: a hung simulation blocks the calling worker.
 */
public class RunExecutor {

    private static final Logger log = LoggerFactory.getLogger(RunExecutor.class);

    public static final String SETTINGS_FILE = LaunchCommandBuilder.SETTINGS_FILE;
    public static final String DESCRIPTOR_FILE = "adios2.xml";

    private final LaunchCommandBuilder launchCommandBuilder;
    private final ObjectWriter settingsWriter;

    public RunExecutor(LaunchCommandBuilder launchCommandBuilder) {
        this.launchCommandBuilder = Objects.requireNonNull(launchCommandBuilder, "LaunchCommandBuilder is required");
        this.settingsWriter = new ObjectMapper().writer(new SettingsPrettyPrinter());
    }

    /**
     * Runs one work item to completion on the calling thread.
     *
     * @param item     the run to execute
     * @param settings job settings providing the executable and the descriptor
     * @param workerId worker recorded on the outcome
     * @return the outcome, successful or not
     */
    public RunOutcome execute(WorkItem item, JobSettings settings, String workerId) {
        Path runDir = item.directory();
        Instant start = Instant.now();

        try {
            createRunDirectory(runDir);
            writeSettings(item, runDir);
            copyDescriptor(settings.getDescriptorPath(), runDir);

            List<String> command = launchCommandBuilder.buildRunCommand(settings.getExecutable());
            int exitCode = launch(command, runDir);
            if (exitCode != 0) {
                throw RunException.exitedWith(exitCode);
            }

            Duration duration = Duration.between(start, Instant.now());
            log.info("Run completed: runDir={}, durationMs={}", runDir, duration.toMillis());
            return RunOutcome.succeeded(runDir, duration, workerId);

        } catch (RunException e) {
            Duration duration = Duration.between(start, Instant.now());
            log.error("Run failed: runDir={}, failureType={}, exitCode={}, error={}, durationMs={}",
                    runDir, e.getFailureType(), e.getExitCode(), e.getMessage(), duration.toMillis());
            return RunOutcome.failed(runDir, e.getFailureType(), e.getExitCode(), e.getMessage(),
                    duration, workerId);
        }
    }

    private void createRunDirectory(Path runDir) throws RunException {
        try {
            Path parent = runDir.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Atomic create-if-absent: a second orchestrator racing on the same point loses here
            Files.createDirectory(runDir);
        } catch (FileAlreadyExistsException e) {
            throw new RunException(FailureType.DIRECTORY_CONFLICT, "Run directory already exists: " + runDir, e);
        } catch (IOException e) {
            throw new RunException(FailureType.IO_ERROR, "Cannot create run directory: " + runDir, e);
        }
    }

    private void writeSettings(WorkItem item, Path runDir) throws RunException {
        byte[] content;
        try {
            content = settingsWriter.writeValueAsBytes(item.config().toMap());
        } catch (JsonProcessingException e) {
            throw new RunException(FailureType.SERIALIZATION_ERROR,
                    "Cannot serialize run config for " + item.name(), e);
        }
        try {
            Files.write(runDir.resolve(SETTINGS_FILE), content);
        } catch (IOException e) {
            throw new RunException(FailureType.IO_ERROR, "Cannot write " + SETTINGS_FILE + " in " + runDir, e);
        }
    }

    private void copyDescriptor(Path descriptor, Path runDir) throws RunException {
        if (!Files.isRegularFile(descriptor)) {
            throw new RunException(FailureType.RESOURCE_UNAVAILABLE, "Descriptor not found: " + descriptor);
        }
        try {
            Files.copy(descriptor, runDir.resolve(DESCRIPTOR_FILE));
        } catch (IOException e) {
            throw new RunException(FailureType.IO_ERROR, "Cannot copy descriptor into " + runDir, e);
        }
    }

    /**
     * Starts the simulation and blocks until it exits.
     *
     * @return the exit status
     */
    protected int launch(List<String> command, Path runDir) throws RunException {
        log.info("Launching run: runDir={}, command={}", runDir, command);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(runDir.toFile())
                    .redirectOutput(runDir.resolve(RunOutcome.STDOUT_FILE).toFile())
                    .redirectError(runDir.resolve(RunOutcome.STDERR_FILE).toFile())
                    .start();
        } catch (IOException e) {
            throw new RunException(FailureType.RESOURCE_UNAVAILABLE,
                    "Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }

        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new RunException(FailureType.INTERRUPTED, "Interrupted while waiting for the simulation", e);
        }
    }

    /**
     * Four-space indented JSON with {@code "key": value} separators.
     */
    private static final class SettingsPrettyPrinter extends DefaultPrettyPrinter {

        SettingsPrettyPrinter() {
            DefaultIndenter indenter = new DefaultIndenter("    ", DefaultIndenter.SYS_LF);
            indentObjectsWith(indenter);
            indentArraysWith(indenter);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new SettingsPrettyPrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }
    }
}
