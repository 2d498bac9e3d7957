package io.github.shedder.window;

/**
 * Inclusive percentile with linear interpolation between the two nearest ranks.
 *
 * <p>For a sorted array {@code v} of length {@code n} and percentile {@code p}:</p>
 * <pre>
 * rank  = (n - 1) * p / 100
 * value = v[floor(rank)] + (v[ceil(rank)] - v[floor(rank)]) * (rank - floor(rank))
 * </pre>
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param sortedData values in ascending order, at least one element
     * @param percentile percentile in [0, 100]
     */
    public static double inclusive(double[] sortedData, double percentile) {
        return inclusive(sortedData, sortedData.length, percentile);
    }

    /**
     * Same as {@link #inclusive(double[], double)} over the first {@code length} elements.
     */
    public static double inclusive(double[] sortedData, int length, double percentile) {
        if (length <= 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of no values");
        }
        if (length == 1) {
            return sortedData[0];
        }

        double rank = (length - 1) * (percentile / 100.0);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);

        if (lower == upper) {
            return sortedData[lower];
        }

        return sortedData[lower] + (sortedData[upper] - sortedData[lower]) * (rank - lower);
    }
}
