package io.github.shedder.window;

/**
 * Aggregate read from a {@link RollingWindow}.
 *
 * @param value aggregated value, or null when the window holds no samples
 * @param pointCount number of samples that contributed
 */
public record WindowResult(Double value, long pointCount) {

    private static final WindowResult EMPTY = new WindowResult(null, 0);

    public WindowResult {
        if (pointCount < 0) {
            throw new IllegalArgumentException("Point count cannot be negative");
        }
        if ((value == null) != (pointCount == 0)) {
            throw new IllegalArgumentException("A value is present exactly when points were recorded");
        }
    }

    /**
     * The no-data result. Distinct from an aggregate that happens to be zero.
     */
    public static WindowResult empty() {
        return EMPTY;
    }

    public static WindowResult of(double value, long pointCount) {
        return new WindowResult(value, pointCount);
    }

    public boolean hasData() {
        return pointCount > 0;
    }
}
