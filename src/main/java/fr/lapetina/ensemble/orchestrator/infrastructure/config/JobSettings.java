package fr.lapetina.ensemble.orchestrator.infrastructure.config;

import fr.lapetina.ensemble.orchestrator.domain.launch.LaunchCommandBuilder;
import fr.lapetina.ensemble.orchestrator.domain.model.SweepSpec;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Bootstrap configuration of the orchestrator.
 * Loaded and validated once at startup, read-only afterwards.
 */
public final class JobSettings {

    private final Path source;
    private final String executable;
    private final Path templatePath;
    private final Path descriptorPath;
    private final Path ensembleRoot;
    private final SweepSpec sweep;
    private final String launcher;
    private final Path metricsFile;

    private JobSettings(Builder builder) {
        this.source = builder.source;
        this.executable = Objects.requireNonNull(builder.executable, "Executable is required");
        this.templatePath = Objects.requireNonNull(builder.templatePath, "Template path is required");
        this.descriptorPath = Objects.requireNonNull(builder.descriptorPath, "Descriptor path is required");
        this.ensembleRoot = Objects.requireNonNull(builder.ensembleRoot, "Ensemble root is required");
        this.sweep = builder.sweep != null ? builder.sweep : SweepSpec.defaults();
        this.launcher = builder.launcher != null ? builder.launcher : LaunchCommandBuilder.AUTO;
        this.metricsFile = builder.metricsFile;
    }

    /** File the settings were read from, null when built in code. */
    public Path getSource() { return source; }

    /** Simulation executable: an absolute path, or a bare command name found on PATH. */
    public String getExecutable() { return executable; }

    public Path getTemplatePath() { return templatePath; }

    /** Auxiliary descriptor copied into every run directory. */
    public Path getDescriptorPath() { return descriptorPath; }

    public Path getEnsembleRoot() { return ensembleRoot; }

    public SweepSpec getSweep() { return sweep; }

    public String getLauncher() { return launcher; }

    public Optional<Path> getMetricsFile() { return Optional.ofNullable(metricsFile); }

    @Override
    public String toString() {
        return "JobSettings{" +
                "executable='" + executable + '\'' +
                ", template=" + templatePath +
                ", descriptor=" + descriptorPath +
                ", ensembleRoot=" + ensembleRoot +
                ", sweep=" + sweep +
                ", launcher='" + launcher + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path source;
        private String executable;
        private Path templatePath;
        private Path descriptorPath;
        private Path ensembleRoot;
        private SweepSpec sweep;
        private String launcher;
        private Path metricsFile;

        public Builder source(Path source) {
            this.source = source;
            return this;
        }

        public Builder executable(String executable) {
            this.executable = executable;
            return this;
        }

        public Builder templatePath(Path templatePath) {
            this.templatePath = templatePath;
            return this;
        }

        public Builder descriptorPath(Path descriptorPath) {
            this.descriptorPath = descriptorPath;
            return this;
        }

        public Builder ensembleRoot(Path ensembleRoot) {
            this.ensembleRoot = ensembleRoot;
            return this;
        }

        public Builder sweep(SweepSpec sweep) {
            this.sweep = sweep;
            return this;
        }

        public Builder launcher(String launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder metricsFile(Path metricsFile) {
            this.metricsFile = metricsFile;
            return this;
        }

        public JobSettings build() {
            return new JobSettings(this);
        }
    }
}
