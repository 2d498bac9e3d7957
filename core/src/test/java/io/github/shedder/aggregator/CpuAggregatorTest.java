package io.github.shedder.aggregator;

import io.github.shedder.MutableClock;
import io.github.shedder.engine.Decision;
import io.github.shedder.engine.DecisionEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CPU Aggregator Tests")
class CpuAggregatorTest {

    private final MutableClock clock = new MutableClock();

    private CpuAggregator aggregator(CpuUsageSource source) {
        return CpuAggregator.builder()
            .thresholds(0.6, 0.8)
            .pollingInterval(Duration.ofSeconds(1))
            .windowSize(10)
            .source(source)
            .clock(clock)
            .build();
    }

    @Test
    @DisplayName("No readings yet -> 0")
    void noDataFailsOpen() {
        CpuAggregator cpu = aggregator(() -> 0.99);
        assertEquals(0.0, cpu.aggregate());
    }

    @Test
    @DisplayName("Steady 70% CPU with thresholds 0.6 / 0.8 -> 0.5")
    void steadyLoad() {
        CpuAggregator cpu = aggregator(() -> 0.7);
        for (int i = 0; i < 10; i++) {
            cpu.sampler().poll();
            clock.advance(Duration.ofSeconds(1));
        }
        assertEquals(0.5, cpu.aggregate(), 1e-9);
    }

    @Test
    @DisplayName("Draw 0.4 is rejected and 0.6 accepted at probability 0.5")
    void engineDraws() {
        CpuAggregator cpu = aggregator(() -> 0.7);
        cpu.sampler().poll();
        DecisionEngine engine = new DecisionEngine(Map.of("cpu", cpu));

        assertEquals(Decision.ACCEPT, engine.decide(0.6));
        assertEquals(Decision.REJECT, engine.decide(0.4));
    }

    @Test
    @DisplayName("Readings are averaged over the window")
    void averagesWindow() {
        double[] readings = {0.6, 0.8};
        AtomicInteger next = new AtomicInteger();
        CpuAggregator cpu = aggregator(() -> readings[next.getAndIncrement() % 2]);

        cpu.sampler().poll();
        clock.advance(Duration.ofSeconds(1));
        cpu.sampler().poll();

        assertEquals(0.7, cpu.window().aggregate().value(), 1e-9);
    }

    @Test
    @DisplayName("Unavailable readings are skipped, readings above 1 are capped")
    void skipsUnavailable() {
        double[] readings = {-1.0, Double.NaN, 1.7};
        AtomicInteger next = new AtomicInteger();
        CpuAggregator cpu = aggregator(() -> readings[next.getAndIncrement()]);

        cpu.sampler().poll();
        cpu.sampler().poll();
        assertEquals(0, cpu.window().pointCount());

        cpu.sampler().poll();
        assertEquals(1.0, cpu.window().aggregate().value());
    }

    @Test
    @DisplayName("A failing source is logged and does not stop sampling")
    void failingSourceKeepsRunning() {
        AtomicInteger calls = new AtomicInteger();
        CpuAggregator cpu = CpuAggregator.builder()
            .thresholds(0.6, 0.8)
            .pollingInterval(Duration.ofMillis(10))
            .windowSize(100)
            .source(() -> {
                if (calls.incrementAndGet() % 2 == 1) {
                    throw new IllegalStateException("probe failed");
                }
                return 0.7;
            })
            .build();

        try {
            cpu.start();
            await().atMost(Duration.ofSeconds(5)).until(() -> cpu.window().pointCount() >= 2);
            assertTrue(cpu.sampler().isRunning());
        } finally {
            cpu.close();
        }
    }

    @Test
    @DisplayName("start() polls in the background, close() stops recording")
    void lifecycle() {
        AtomicInteger calls = new AtomicInteger();
        CpuAggregator cpu = CpuAggregator.builder()
            .thresholds(0.6, 0.8)
            .pollingInterval(Duration.ofMillis(10))
            .windowSize(100)
            .source(() -> {
                calls.incrementAndGet();
                return 0.7;
            })
            .build();

        cpu.start();
        cpu.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> calls.get() >= 3);
        assertEquals(0.5, cpu.aggregate(), 1e-9);

        cpu.close();
        assertFalse(cpu.sampler().isRunning());

        int afterStop = calls.get();
        cpu.sampler().poll();
        await().during(Duration.ofMillis(100)).atMost(Duration.ofSeconds(1))
            .until(() -> calls.get() == afterStop);

        // a stopped sampler stays stopped
        cpu.start();
        assertFalse(cpu.sampler().isRunning());
        cpu.close();
    }

    @Test
    @DisplayName("A reading still in progress at close() is never recorded")
    void slowReadingDroppedAfterClose() throws InterruptedException {
        CountDownLatch reading = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        CpuAggregator cpu = CpuAggregator.builder()
            .thresholds(0.6, 0.8)
            .pollingInterval(Duration.ofMillis(10))
            .windowSize(200)
            .source(() -> {
                if (calls.incrementAndGet() == 1) {
                    reading.countDown();
                    // busy wait, deaf to interrupts
                    long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(400);
                    while (System.nanoTime() < until) {
                        Thread.onSpinWait();
                    }
                }
                return 0.7;
            })
            .build();

        cpu.start();
        assertTrue(reading.await(5, TimeUnit.SECONDS));
        cpu.close();

        assertEquals(0, cpu.window().pointCount());
        await().during(Duration.ofMillis(600)).atMost(Duration.ofSeconds(2))
            .until(() -> cpu.window().pointCount() == 0);
    }

    @Test
    @DisplayName("Builder requires thresholds and a sane interval")
    void validation() {
        assertThrows(IllegalStateException.class, () -> CpuAggregator.builder().build());
        assertThrows(IllegalArgumentException.class, () -> CpuAggregator.builder().thresholds(0.8, 0.6).build());
        assertThrows(IllegalArgumentException.class, () -> CpuAggregator.builder()
            .thresholds(0.6, 0.8)
            .pollingInterval(Duration.ZERO)
            .build());
        assertThrows(IllegalArgumentException.class, () -> CpuAggregator.builder()
            .thresholds(0.6, 0.8)
            .windowSize(0)
            .build());
    }
}
