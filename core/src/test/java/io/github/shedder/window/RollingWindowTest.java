package io.github.shedder.window;

import io.github.shedder.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RollingWindow Tests")
class RollingWindowTest {

    private static final Duration BUCKET = Duration.ofSeconds(1);

    private final MutableClock clock = new MutableClock();

    private RollingWindow window(Aggregation aggregation) {
        return RollingWindow.builder()
            .clock(clock)
            .bucketSize(BUCKET)
            .buckets(10)
            .aggregation(aggregation)
            .build();
    }

    // ============================================
    // 1. Aggregation
    // ============================================

    @Test
    @DisplayName("Average over all retained buckets")
    void average() {
        RollingWindow window = window(Aggregation.average());

        window.record(1.0);
        clock.advance(BUCKET);
        window.record(2.0);
        clock.advance(BUCKET);
        window.record(6.0);

        WindowResult result = window.aggregate();
        assertTrue(result.hasData());
        assertEquals(3.0, result.value(), 1e-9);
        assertEquals(3, result.pointCount());
    }

    @Test
    @DisplayName("Sum over all retained buckets")
    void sum() {
        RollingWindow window = window(Aggregation.sum());

        for (int i = 0; i < 5; i++) {
            window.record(2.5);
            clock.advance(Duration.ofMillis(700));
        }

        WindowResult result = window.aggregate();
        assertEquals(12.5, result.value(), 1e-9);
        assertEquals(5, result.pointCount());
    }

    @Test
    @DisplayName("Empty window reports no data rather than zero")
    void emptyIsDistinctFromZero() {
        RollingWindow window = window(Aggregation.average());

        WindowResult empty = window.aggregate();
        assertFalse(empty.hasData());
        assertNull(empty.value());
        assertEquals(0, empty.pointCount());

        window.record(0.0);
        WindowResult zero = window.aggregate();
        assertTrue(zero.hasData());
        assertEquals(0.0, zero.value());
    }

    @Test
    @DisplayName("P95 of 1..100 uses linear interpolation between ranks")
    void percentileOfOneToHundred() {
        RollingWindow window = window(Aggregation.percentile(95));

        for (int i = 1; i <= 100; i++) {
            window.record(i);
        }

        // rank = 99 * 0.95 = 94.05 -> 95 + (96 - 95) * 0.05
        assertEquals(95.05, window.aggregate().value(), 1e-9);
        assertEquals(100, window.aggregate().pointCount());
    }

    @Test
    @DisplayName("Percentile merges buckets and ignores insertion order")
    void percentileIsOrderIndependent() {
        List<Double> values = new ArrayList<>();
        for (int i = 1; i <= 200; i++) {
            values.add((double) i * 3 % 101);
        }

        RollingWindow ordered = window(Aggregation.percentile(99));
        values.stream().sorted().forEach(ordered::record);
        double expected = ordered.aggregate().value();

        Collections.shuffle(values, new Random(42));
        RollingWindow shuffled = window(Aggregation.percentile(99));
        for (int i = 0; i < values.size(); i++) {
            shuffled.record(values.get(i));
            if (i % 40 == 0) {
                clock.advance(BUCKET);
            }
        }

        assertEquals(expected, shuffled.aggregate().value(), 1e-9);
    }

    @Test
    @DisplayName("Preallocation hint does not change results")
    void preallocationHintIsInvisible() {
        RollingWindow plain = window(Aggregation.percentile(50));
        RollingWindow hinted = RollingWindow.builder()
            .clock(clock)
            .bucketSize(BUCKET)
            .buckets(10)
            .aggregation(Aggregation.percentile(50))
            .preallocationHint(1024)
            .build();

        for (int i = 0; i < 37; i++) {
            plain.record(i * 1.5);
            hinted.record(i * 1.5);
        }

        assertEquals(plain.aggregate(), hinted.aggregate());
    }

    // ============================================
    // 2. Rotation
    // ============================================

    @Test
    @DisplayName("A sample disappears once the full span has passed")
    void expiresAfterSpan() {
        RollingWindow window = window(Aggregation.average());
        window.record(42.0);

        clock.advance(Duration.ofSeconds(9));
        assertEquals(1, window.aggregate().pointCount());

        clock.advance(Duration.ofSeconds(1));
        WindowResult result = window.aggregate();
        assertFalse(result.hasData());
        assertEquals(0, result.pointCount());
    }

    @Test
    @DisplayName("Partial rotation clears only the oldest buckets")
    void partialRotation() {
        RollingWindow window = window(Aggregation.sum());

        window.record(1.0);                       // bucket 0
        clock.advance(Duration.ofSeconds(3));
        window.record(10.0);                      // bucket 3
        clock.advance(Duration.ofSeconds(7));     // bucket 10: bucket 0 falls out

        WindowResult result = window.aggregate();
        assertEquals(10.0, result.value(), 1e-9);
        assertEquals(1, result.pointCount());

        clock.advance(Duration.ofSeconds(3));     // bucket 13: bucket 3 falls out
        assertFalse(window.aggregate().hasData());
    }

    @Test
    @DisplayName("A long idle period clears everything and the window keeps working")
    void idleGapClearsWindow() {
        RollingWindow window = window(Aggregation.average());
        for (int i = 0; i < 10; i++) {
            window.record(5.0);
            clock.advance(BUCKET);
        }

        clock.advance(Duration.ofHours(1));
        assertFalse(window.aggregate().hasData());

        window.record(7.0);
        assertEquals(7.0, window.aggregate().value(), 1e-9);
        assertEquals(1, window.pointCount());
    }

    @Test
    @DisplayName("A clock stepping backwards keeps writing into the active bucket")
    void clockGoingBackwards() {
        RollingWindow window = window(Aggregation.sum());
        clock.advance(Duration.ofSeconds(5));
        window.record(1.0);

        clock.advance(Duration.ofSeconds(-3));
        window.record(2.0);

        assertEquals(3.0, window.aggregate().value(), 1e-9);
    }

    @Test
    @DisplayName("clear() drops retained samples")
    void clear() {
        RollingWindow window = window(Aggregation.average());
        window.record(3.0);
        window.clear();
        assertFalse(window.aggregate().hasData());
    }

    @Test
    @DisplayName("Span is buckets times bucket size")
    void span() {
        RollingWindow window = window(Aggregation.average());
        assertEquals(Duration.ofSeconds(10), window.span());
        assertEquals(10, window.buckets());
        assertEquals(BUCKET, window.bucketSize());
    }

    // ============================================
    // 3. Concurrency
    // ============================================

    @Test
    @DisplayName("Concurrent writers lose no samples")
    void concurrentWriters() throws InterruptedException {
        RollingWindow window = window(Aggregation.sum());
        int threads = 8;
        int perThread = 10_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    window.record(1.0);
                    if (i % 1000 == 0) {
                        window.aggregate();
                    }
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

        WindowResult result = window.aggregate();
        assertEquals(threads * perThread, result.pointCount());
        assertEquals(threads * perThread, result.value(), 1e-6);
    }

    // ============================================
    // 4. Validation
    // ============================================

    @Test
    @DisplayName("Invalid window parameters fail at construction")
    void validation() {
        assertThrows(IllegalArgumentException.class,
            () -> RollingWindow.builder().buckets(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> RollingWindow.builder().bucketSize(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> RollingWindow.builder().bucketSize(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
            () -> RollingWindow.builder().preallocationHint(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> Aggregation.percentile(101));
        assertThrows(IllegalArgumentException.class,
            () -> Aggregation.percentile(Double.NaN));
    }
}
