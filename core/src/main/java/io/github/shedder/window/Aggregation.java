package io.github.shedder.window;

/**
 * How a {@link RollingWindow} folds its retained buckets into one value.
 *
 * <ul>
 *   <li>{@link Kind#SUM} - total of all samples in the window</li>
 *   <li>{@link Kind#AVERAGE} - total divided by sample count</li>
 *   <li>{@link Kind#PERCENTILE} - p-th percentile (0-100) of the raw samples</li>
 * </ul>
 *
 * @param kind aggregation kind
 * @param percentile target percentile in [0, 100], only meaningful for {@link Kind#PERCENTILE}
 */
public record Aggregation(Kind kind, double percentile) {

    private static final Aggregation SUM = new Aggregation(Kind.SUM, -1);
    private static final Aggregation AVERAGE = new Aggregation(Kind.AVERAGE, -1);

    public Aggregation {
        if (kind == null) {
            throw new IllegalArgumentException("Aggregation kind cannot be null");
        }
        if (kind == Kind.PERCENTILE && !(percentile >= 0 && percentile <= 100)) {
            throw new IllegalArgumentException("Percentile must be within [0, 100], got " + percentile);
        }
    }

    public static Aggregation sum() {
        return SUM;
    }

    public static Aggregation average() {
        return AVERAGE;
    }

    /**
     * Percentile aggregation, e.g. {@code percentile(95)} for P95.
     */
    public static Aggregation percentile(double percentile) {
        return new Aggregation(Kind.PERCENTILE, percentile);
    }

    /**
     * Whether buckets must retain raw sample values.
     */
    public boolean retainsValues() {
        return kind == Kind.PERCENTILE;
    }

    @Override
    public String toString() {
        return kind == Kind.PERCENTILE ? "P" + percentile : kind.name();
    }

    public enum Kind {
        SUM,
        AVERAGE,
        PERCENTILE
    }
}
