package fr.lapetina.ensemble.orchestrator.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Two-dimensional parameter grid: one axis for the feed rate {@code F},
 * one for the kill rate {@code k}.
 * Immutable and thread-safe.
 */
public record SweepSpec(Axis feedRate, Axis killRate) {

    /** Decimal places every grid value is rounded to. Directory names depend on it. */
    public static final int PRECISION = 3;

    public SweepSpec {
        Objects.requireNonNull(feedRate, "Feed rate axis is required");
        Objects.requireNonNull(killRate, "Kill rate axis is required");
    }

    /**
     * The 10 x 10 grid the orchestrator sweeps when no sweep is configured.
     */
    public static SweepSpec defaults() {
        return new SweepSpec(new Axis(0.01, 0.01, 10), new Axis(0.05, 0.05, 10));
    }

    /**
     * Total number of grid points.
     */
    public int size() {
        return feedRate.count() * killRate.count();
    }

    /**
     * One sweep axis: {@code count} values starting at {@code base}, {@code step} apart.
     */
    public record Axis(double base, double step, int count) {

        public Axis {
            if (count < 0) {
                throw new IllegalArgumentException("Axis count must not be negative: " + count);
            }
            if (!Double.isFinite(base) || !Double.isFinite(step)) {
                throw new IllegalArgumentException("Axis base and step must be finite");
            }
        }

        /**
         * Returns {@code base + index * step} rounded to {@link #PRECISION} decimals.
         * The rounding is half-even on the exact binary value of the sum, so
         * {@code 0.05 + 2 * 0.05} gives 0.15 and not 0.15000000000000002.
         */
        public double valueAt(int index) {
            if (index < 0 || index >= count) {
                throw new IndexOutOfBoundsException("Index " + index + " outside axis of " + count);
            }
            double raw = base + index * step;
            return new BigDecimal(raw).setScale(PRECISION, RoundingMode.HALF_EVEN).doubleValue();
        }
    }

    /**
     * Canonical text of a grid value as used in directory names:
     * shortest round-tripping decimal, always with a fractional digit ({@code 0.1}, {@code 1.0}).
     */
    public static String format(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() <= 0) {
            decimal = decimal.setScale(1);
        }
        return decimal.toPlainString();
    }
}
