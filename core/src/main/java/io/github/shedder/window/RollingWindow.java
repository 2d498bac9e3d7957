package io.github.shedder.window;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Time-bucketed rolling window over numeric samples.
 *
 * <p>The window is a ring of {@code buckets} slots, each covering {@code bucketSize} of wall-clock
 * time, so it spans {@code buckets × bucketSize}. Rotation is lazy: every {@link #record(double)}
 * and {@link #aggregate()} first works out how many bucket widths have passed since the last access
 * and clears that many of the oldest slots. No timer is involved, and samples older than the span
 * are never part of an aggregate.</p>
 *
 * <p>All access goes through a single lock, so a record is either fully visible to an aggregate
 * or not at all, even when both race across a rotation boundary.</p>
 *
 * <pre>{@code
 * RollingWindow window = RollingWindow.builder()
 *     .bucketSize(Duration.ofSeconds(1))
 *     .buckets(10)
 *     .aggregation(Aggregation.percentile(95))
 *     .build();
 *
 * window.record(120.0);
 * WindowResult p95 = window.aggregate();
 * }</pre>
 */
public class RollingWindow {

    private final Clock clock;
    private final long bucketMillis;
    private final Bucket[] ring;
    private final Aggregation aggregation;
    private final long epochMillis;
    private final ReentrantLock lock = new ReentrantLock();

    // Absolute index (since epoch) of the active bucket; guarded by lock
    private long lastIndex;

    private RollingWindow(Builder builder) {
        this.clock = builder.clock;
        this.bucketMillis = builder.bucketSize.toMillis();
        this.aggregation = builder.aggregation;
        this.ring = new Bucket[builder.buckets];
        for (int i = 0; i < ring.length; i++) {
            ring[i] = new Bucket(aggregation.retainsValues(), builder.preallocationHint);
        }
        this.epochMillis = clock.millis();
        this.lastIndex = 0;
    }

    /**
     * Window on the system clock with no preallocation.
     */
    public static RollingWindow of(Duration bucketSize, int buckets, Aggregation aggregation) {
        return builder().bucketSize(bucketSize).buckets(buckets).aggregation(aggregation).build();
    }

    // ============ Write ============

    /**
     * Add a sample to the bucket that is active right now.
     */
    public void record(double value) {
        lock.lock();
        try {
            rotate();
            ring[slot(lastIndex)].add(value);
        } finally {
            lock.unlock();
        }
    }

    // ============ Read ============

    /**
     * Fold all buckets still inside the span into one result.
     *
     * @return the aggregate, or {@link WindowResult#empty()} when no sample is in the span
     */
    public WindowResult aggregate() {
        long count = 0;
        double sum = 0;
        double[] values = null;
        int size = 0;

        lock.lock();
        try {
            rotate();
            for (Bucket bucket : ring) {
                count += bucket.count();
                sum += bucket.sum();
            }
            if (count > 0 && aggregation.retainsValues()) {
                for (Bucket bucket : ring) {
                    size += bucket.size();
                }
                values = new double[size];
                int offset = 0;
                for (Bucket bucket : ring) {
                    offset = bucket.copyValuesTo(values, offset);
                }
            }
        } finally {
            lock.unlock();
        }

        if (count == 0) {
            return WindowResult.empty();
        }

        return switch (aggregation.kind()) {
            case SUM -> WindowResult.of(sum, count);
            case AVERAGE -> WindowResult.of(sum / count, count);
            case PERCENTILE -> {
                Arrays.sort(values, 0, size);
                yield WindowResult.of(Percentiles.inclusive(values, size, aggregation.percentile()), count);
            }
        };
    }

    /**
     * Number of samples currently inside the span.
     */
    public long pointCount() {
        lock.lock();
        try {
            rotate();
            long count = 0;
            for (Bucket bucket : ring) {
                count += bucket.count();
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every retained sample.
     */
    public void clear() {
        lock.lock();
        try {
            rotate();
            for (Bucket bucket : ring) {
                bucket.reset();
            }
        } finally {
            lock.unlock();
        }
    }

    public Duration span() {
        return Duration.ofMillis(bucketMillis * ring.length);
    }

    public Duration bucketSize() {
        return Duration.ofMillis(bucketMillis);
    }

    public int buckets() {
        return ring.length;
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    // ============ Rotation ============

    private void rotate() {
        long index = Math.floorDiv(clock.millis() - epochMillis, bucketMillis);
        long elapsed = index - lastIndex;
        if (elapsed <= 0) {
            // Same bucket, or the clock stepped backwards: keep writing to the active slot
            return;
        }

        if (elapsed >= ring.length) {
            for (Bucket bucket : ring) {
                bucket.reset();
            }
        } else {
            for (long i = 1; i <= elapsed; i++) {
                ring[slot(lastIndex + i)].reset();
            }
        }
        lastIndex = index;
    }

    private int slot(long index) {
        return (int) Math.floorMod(index, (long) ring.length);
    }

    // ============ Builder ============

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Clock clock = Clock.systemUTC();
        private Duration bucketSize = Duration.ofSeconds(1);
        private int buckets = 10;
        private Aggregation aggregation = Aggregation.average();
        private int preallocationHint = 0;

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder bucketSize(Duration bucketSize) {
            this.bucketSize = bucketSize;
            return this;
        }

        public Builder buckets(int buckets) {
            this.buckets = buckets;
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        /**
         * Expected samples per bucket. Sizes raw-value storage up front; results are unaffected.
         */
        public Builder preallocationHint(int preallocationHint) {
            this.preallocationHint = preallocationHint;
            return this;
        }

        public RollingWindow build() {
            if (clock == null) {
                throw new IllegalStateException("Clock is required");
            }
            if (aggregation == null) {
                throw new IllegalStateException("Aggregation is required");
            }
            if (bucketSize == null || bucketSize.toMillis() <= 0) {
                throw new IllegalArgumentException("Bucket size must be at least 1ms, got " + bucketSize);
            }
            if (buckets <= 0) {
                throw new IllegalArgumentException("Bucket count must be positive, got " + buckets);
            }
            if (preallocationHint < 0) {
                throw new IllegalArgumentException("Preallocation hint cannot be negative, got " + preallocationHint);
            }
            return new RollingWindow(this);
        }
    }
}
