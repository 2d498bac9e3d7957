package io.github.shedder.config;

import java.time.Duration;

final class Thresholds {

    private Thresholds() {
    }

    static void check(String option, double lower, double upper) {
        if (!Double.isFinite(lower) || !Double.isFinite(upper) || lower >= upper) {
            throw new IllegalArgumentException(
                option + ": lower threshold must be below upper threshold, got lower=" + lower + ", upper=" + upper);
        }
    }

    static void check(String option, Duration lower, Duration upper) {
        if (lower == null || upper == null) {
            throw new IllegalArgumentException(option + ": lower and upper thresholds are required");
        }
        if (lower.isNegative()) {
            throw new IllegalArgumentException(option + ": lower threshold cannot be negative, got " + lower);
        }
        if (lower.compareTo(upper) >= 0) {
            throw new IllegalArgumentException(
                option + ": lower threshold must be below upper threshold, got lower=" + lower + ", upper=" + upper);
        }
    }

    static void checkWindow(String option, Duration bucketSize, int buckets, int requiredPoints, int preallocationHint) {
        if (bucketSize.toMillis() <= 0) {
            throw new IllegalArgumentException(option + ": bucket size must be at least 1ms, got " + bucketSize);
        }
        if (buckets <= 0) {
            throw new IllegalArgumentException(option + ": bucket count must be positive, got " + buckets);
        }
        if (requiredPoints < 0) {
            throw new IllegalArgumentException(option + ": required points cannot be negative, got " + requiredPoints);
        }
        if (preallocationHint < 0) {
            throw new IllegalArgumentException(option + ": preallocation hint cannot be negative, got " + preallocationHint);
        }
    }
}
