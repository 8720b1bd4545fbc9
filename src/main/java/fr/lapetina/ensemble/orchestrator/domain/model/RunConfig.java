package fr.lapetina.ensemble.orchestrator.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The full parameter set of one simulation run.
 * Immutable and thread-safe.
 *
 * <p>The two sweep keys ({@code F} and {@code k}) are carried as typed fields.
 * Every other key of the template passes through untouched in {@code parameters},
 * in template order. When the template itself carries {@code F} or {@code k},
 * those entries are superseded by the typed fields on serialization.
 */
public record RunConfig(
        double feedRate,
        double killRate,
        Map<String, Object> parameters
) {
    public static final String FEED_RATE_KEY = "F";
    public static final String KILL_RATE_KEY = "k";

    public RunConfig {
        // LinkedHashMap: keeps template order and tolerates JSON nulls
        parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    /**
     * Creates a config from a parsed template object.
     * Sweep keys missing from the template start out as NaN until a sweep point is applied.
     */
    public static RunConfig fromTemplate(Map<String, Object> template) {
        return new RunConfig(
                numberOrNaN(template.get(FEED_RATE_KEY)),
                numberOrNaN(template.get(KILL_RATE_KEY)),
                template
        );
    }

    /**
     * Returns a copy of this config with both sweep keys overwritten.
     */
    public RunConfig withSweepPoint(double feedRate, double killRate) {
        return new RunConfig(feedRate, killRate, parameters);
    }

    /**
     * Returns the serializable view: template keys in order, sweep keys in their
     * template position (appended when the template lacks them).
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(parameters);
        map.put(FEED_RATE_KEY, feedRate);
        map.put(KILL_RATE_KEY, killRate);
        return map;
    }

    private static double numberOrNaN(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : Double.NaN;
    }
}
