package io.github.shedder.aggregator;

import io.github.shedder.window.RollingWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background poller feeding CPU readings into a rolling window.
 *
 * <p>Runs on its own daemon thread, independent of request handling. {@link #stop()} halts future
 * polls and waits a bounded time for one that is already running, so no reading is recorded after
 * it returns and the caller is never blocked indefinitely.</p>
 */
public class CpuSampler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CpuSampler.class);

    private static final Duration MAX_STOP_WAIT = Duration.ofSeconds(5);

    private final CpuUsageSource source;
    private final RollingWindow window;
    private final Duration pollingInterval;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;
    private volatile boolean stopped;

    public CpuSampler(CpuUsageSource source, RollingWindow window, Duration pollingInterval) {
        if (source == null) {
            throw new IllegalArgumentException("CPU usage source cannot be null");
        }
        if (window == null) {
            throw new IllegalArgumentException("Window cannot be null");
        }
        if (pollingInterval == null || pollingInterval.toMillis() <= 0) {
            throw new IllegalArgumentException("Polling interval must be at least 1ms, got " + pollingInterval);
        }
        this.source = source;
        this.window = window;
        this.pollingInterval = pollingInterval;
    }

    /**
     * Start polling. Calling it again while running has no effect; a stopped sampler stays stopped.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null || stopped) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "shedder-cpu-sampler");
                t.setDaemon(true);
                return t;
            });
            long intervalMs = pollingInterval.toMillis();
            scheduler.scheduleAtFixedRate(this::poll, 0, intervalMs, TimeUnit.MILLISECONDS);
        }
        log.info("CPU sampling started with interval: {}ms", pollingInterval.toMillis());
    }

    /**
     * Take one reading now. Also used by the scheduled task.
     */
    void poll() {
        if (stopped) {
            return;
        }
        try {
            double usage = source.currentUsage();
            if (usage < 0 || Double.isNaN(usage)) {
                log.debug("CPU usage unavailable, skipping sample");
                return;
            }
            // A reading that outlives stop() is dropped
            synchronized (lifecycleLock) {
                if (stopped) {
                    return;
                }
                window.record(Math.min(1.0, usage));
            }
        } catch (Exception e) {
            log.warn("Error sampling CPU usage", e);
        }
    }

    /**
     * Stop polling and release the timer thread.
     */
    public void stop() {
        ScheduledExecutorService toStop;
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            toStop = scheduler;
            scheduler = null;
        }
        if (toStop == null) {
            return;
        }

        toStop.shutdown();
        try {
            long waitMs = Math.min(MAX_STOP_WAIT.toMillis(), Math.max(100, pollingInterval.toMillis()));
            if (!toStop.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("CPU sampler did not finish within {}ms, interrupting", waitMs);
                toStop.shutdownNow();
            }
        } catch (InterruptedException e) {
            toStop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("CPU sampling stopped");
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return scheduler != null && !stopped;
        }
    }

    public Duration pollingInterval() {
        return pollingInterval;
    }

    @Override
    public void close() {
        stop();
    }
}
