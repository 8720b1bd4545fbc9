package fr.lapetina.ensemble.orchestrator.infrastructure.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ensemble.orchestrator.domain.launch.LaunchCommandBuilder;
import fr.lapetina.ensemble.orchestrator.domain.launch.LaunchStrategyFactory;
import fr.lapetina.ensemble.orchestrator.domain.model.RunConfig;
import fr.lapetina.ensemble.orchestrator.domain.model.SweepSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads and validates the startup configuration.
 *
 * Supports:
 * - JSON artifacts (the native format), parsed with Jackson
 * - YAML artifacts ({@code .yaml} / {@code .yml}), parsed with SnakeYAML
 * - Executables given as a bare command name resolved on PATH
 *
 * Every failure is reported as a {@link ConfigValidationException} before any worker starts.
 */
public final class JobSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(JobSettingsLoader.class);

    public static final String EXECUTABLE_KEY = "gs_exe";
    public static final String TEMPLATE_KEY = "gs_json";
    public static final String DESCRIPTOR_KEY = "adios2_xml";
    public static final String ENSEMBLE_ROOT_KEY = "ensemble_root";
    public static final String SWEEP_KEY = "sweep";
    public static final String LAUNCHER_KEY = "launcher";
    public static final String METRICS_FILE_KEY = "metrics_file";

    public static final List<String> REQUIRED_KEYS =
            List.of(EXECUTABLE_KEY, TEMPLATE_KEY, DESCRIPTOR_KEY, ENSEMBLE_ROOT_KEY);

    private final ObjectMapper objectMapper;
    private final Yaml yaml;
    private final String searchPath;

    /**
     * @param searchPath PATH-style directory list used to resolve bare executable names, may be null
     */
    public JobSettingsLoader(String searchPath) {
        this.objectMapper = new ObjectMapper();
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        this.searchPath = searchPath;
    }

    public JobSettingsLoader() {
        this(System.getenv("PATH"));
    }

    /**
     * Loads and validates the startup configuration.
     *
     * @param configPath path of the JSON or YAML artifact
     * @return the validated settings
     * @throws ConfigValidationException if the artifact is unreadable, a required key is
     *                                   missing, or a referenced path does not exist
     */
    public JobSettings load(Path configPath) {
        Map<String, Object> raw = readArtifact(configPath);

        List<String> missing = REQUIRED_KEYS.stream()
                .filter(key -> !raw.containsKey(key))
                .toList();
        if (!missing.isEmpty()) {
            throw new ConfigValidationException(
                    "Need " + configPath + " to contain " + REQUIRED_KEYS + ", missing " + missing);
        }

        JobSettings settings = JobSettings.builder()
                .source(configPath)
                .executable(resolveExecutable(requireString(raw, EXECUTABLE_KEY)))
                .templatePath(requireExistingPath(raw, TEMPLATE_KEY))
                .descriptorPath(requireExistingPath(raw, DESCRIPTOR_KEY))
                .ensembleRoot(requireExistingPath(raw, ENSEMBLE_ROOT_KEY))
                .sweep(parseSweep(raw.get(SWEEP_KEY)))
                .launcher(parseLauncher(raw.get(LAUNCHER_KEY)))
                .metricsFile(parseOptionalPath(raw, METRICS_FILE_KEY))
                .build();

        log.info("Job settings loaded: source={}, settings={}", configPath, settings);
        return settings;
    }

    /**
     * Reads the parameter template the settings point to.
     *
     * @throws ConfigValidationException if the template is not a JSON object
     */
    public RunConfig loadTemplate(JobSettings settings) {
        Path templatePath = settings.getTemplatePath();
        try {
            Map<String, Object> template = objectMapper.readValue(
                    templatePath.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {});
            if (template == null) {
                throw new ConfigValidationException("Template is empty: " + templatePath);
            }
            log.info("Template loaded: path={}, keys={}", templatePath, template.size());
            return RunConfig.fromTemplate(template);
        } catch (JsonProcessingException e) {
            throw new ConfigValidationException("Template is not a JSON object: " + templatePath, e);
        } catch (IOException e) {
            throw new ConfigValidationException("Failed to read template: " + templatePath, e);
        }
    }

    private Map<String, Object> readArtifact(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigValidationException("Configuration file not found: " + configPath);
        }

        Object parsed;
        try {
            if (isYaml(configPath)) {
                log.info("Loading configuration from YAML file: {}", configPath);
                try (InputStream in = Files.newInputStream(configPath)) {
                    parsed = yaml.load(in);
                }
            } else {
                log.info("Loading configuration from JSON file: {}", configPath);
                parsed = objectMapper.readValue(configPath.toFile(), Object.class);
            }
        } catch (IOException | YAMLException e) {
            throw new ConfigValidationException("Failed to parse configuration: " + configPath, e);
        }

        if (!(parsed instanceof Map)) {
            throw new ConfigValidationException("Configuration must be a key/value object: " + configPath);
        }
        Map<?, ?> map = (Map<?, ?>) parsed;

        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }

    private static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static String requireString(Map<String, Object> raw, String key) {
        Object value = raw.get(key);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            throw new ConfigValidationException("Key '" + key + "' must be a non-empty string, got: " + value);
        }
        return (String) value;
    }

    private static Path requireExistingPath(Map<String, Object> raw, String key) {
        String value = requireString(raw, key);
        Path path = toPath(key, value);
        if (!Files.exists(path)) {
            throw new ConfigValidationException("Path for '" + key + "' does not exist: " + value);
        }
        return path.toAbsolutePath().normalize();
    }

    private static Path parseOptionalPath(Map<String, Object> raw, String key) {
        if (raw.get(key) == null) {
            return null;
        }
        return toPath(key, requireString(raw, key)).toAbsolutePath().normalize();
    }

    private static Path toPath(String key, String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new ConfigValidationException("Key '" + key + "' is not a valid path: " + value, e);
        }
    }

    /**
     * An executable that exists as a file is made absolute, because runs start in their own
     * directory. A bare name is kept as-is if PATH contains it.
     */
    private String resolveExecutable(String value) {
        Path path = toPath(EXECUTABLE_KEY, value);
        if (Files.exists(path)) {
            return path.toAbsolutePath().normalize().toString();
        }
        if (path.getNameCount() == 1 && !path.isAbsolute() && isOnSearchPath(value)) {
            log.debug("Executable resolved on PATH: {}", value);
            return value;
        }
        throw new ConfigValidationException("Path for '" + EXECUTABLE_KEY + "' does not exist: " + value);
    }

    private boolean isOnSearchPath(String name) {
        if (searchPath == null || searchPath.isBlank()) {
            return false;
        }
        for (String directory : searchPath.split(File.pathSeparator)) {
            if (directory.isBlank()) {
                continue;
            }
            try {
                Path candidate = Path.of(directory, name);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return true;
                }
            } catch (InvalidPathException e) {
                log.debug("Ignoring invalid PATH entry: {}", directory);
            }
        }
        return false;
    }

    private static SweepSpec parseSweep(Object value) {
        SweepSpec defaults = SweepSpec.defaults();
        if (value == null) {
            return defaults;
        }
        if (!(value instanceof Map)) {
            throw new ConfigValidationException("Key '" + SWEEP_KEY + "' must be an object");
        }
        Map<?, ?> sweep = (Map<?, ?>) value;
        try {
            return new SweepSpec(
                    parseAxis(sweep.get(RunConfig.FEED_RATE_KEY), RunConfig.FEED_RATE_KEY, defaults.feedRate()),
                    parseAxis(sweep.get(RunConfig.KILL_RATE_KEY), RunConfig.KILL_RATE_KEY, defaults.killRate())
            );
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException("Invalid sweep: " + e.getMessage(), e);
        }
    }

    private static SweepSpec.Axis parseAxis(Object value, String name, SweepSpec.Axis defaults) {
        if (value == null) {
            return defaults;
        }
        if (!(value instanceof Map)) {
            throw new ConfigValidationException("Sweep axis '" + name + "' must be an object");
        }
        Map<?, ?> axis = (Map<?, ?>) value;
        double base = number(axis.get("base"), name + ".base", defaults.base());
        double step = number(axis.get("step"), name + ".step", defaults.step());
        double count = number(axis.get("count"), name + ".count", defaults.count());
        if (count != Math.rint(count)) {
            throw new ConfigValidationException("Sweep axis '" + name + ".count' must be an integer: " + count);
        }
        return new SweepSpec.Axis(base, step, (int) count);
    }

    private static double number(Object value, String name, double fallback) {
        if (value == null) {
            return fallback;
        }
        if (!(value instanceof Number)) {
            throw new ConfigValidationException("Sweep value '" + name + "' must be a number, got: " + value);
        }
        return ((Number) value).doubleValue();
    }

    private static String parseLauncher(Object value) {
        if (value == null) {
            return LaunchCommandBuilder.AUTO;
        }
        String launcher = String.valueOf(value).trim();
        if (!LaunchCommandBuilder.AUTO.equalsIgnoreCase(launcher) && !LaunchStrategyFactory.isRegistered(launcher)) {
            throw new ConfigValidationException("Unknown launcher '" + launcher + "', expected "
                    + LaunchCommandBuilder.AUTO + " or one of " + LaunchStrategyFactory.getRegisteredNames());
        }
        return launcher;
    }

    /**
     * Exception for invalid startup configuration.
     */
    public static class ConfigValidationException extends RuntimeException {
        public ConfigValidationException(String message) {
            super(message);
        }

        public ConfigValidationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
