package io.github.shedder.aggregator;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock-free count of requests currently in flight.
 *
 * <p>Usable on its own, e.g. to drain a server on shutdown:</p>
 * <pre>{@code
 * ConcurrencyCounter inFlight = new ConcurrencyCounter();
 *
 * try (ConcurrencyCounter.Scope scope = inFlight.track()) {
 *     handle(request);
 * }
 *
 * // on shutdown
 * boolean drained = inFlight.awaitIdle(Duration.ofSeconds(30));
 * }</pre>
 */
public class ConcurrencyCounter {

    private final AtomicLong value = new AtomicLong();
    private final Object idleMonitor = new Object();

    public long increment() {
        return value.incrementAndGet();
    }

    /**
     * @throws IllegalStateException if called more often than {@link #increment()}; the counter stays at 0
     */
    public long decrement() {
        while (true) {
            long current = value.get();
            if (current <= 0) {
                throw new IllegalStateException("Concurrency counter decremented below zero");
            }
            if (value.compareAndSet(current, current - 1)) {
                if (current == 1) {
                    synchronized (idleMonitor) {
                        idleMonitor.notifyAll();
                    }
                }
                return current - 1;
            }
        }
    }

    public long current() {
        return value.get();
    }

    /**
     * Increment now and decrement exactly once when the returned scope closes.
     */
    public Scope track() {
        increment();
        return new Scope(this);
    }

    /**
     * Block until no request is in flight.
     *
     * @return true if the counter reached zero, false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (idleMonitor) {
            while (value.get() > 0) {
                long remainingNanos = deadline - System.nanoTime();
                if (remainingNanos <= 0) {
                    return false;
                }
                long millis = Math.max(1, remainingNanos / 1_000_000);
                idleMonitor.wait(millis);
            }
            return true;
        }
    }

    @Override
    public String toString() {
        return "ConcurrencyCounter[" + value.get() + "]";
    }

    /**
     * Decrements its counter once on close.
     */
    public static final class Scope implements RequestObserver.Sample {
        private final ConcurrencyCounter counter;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private Scope(ConcurrencyCounter counter) {
            this.counter = counter;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                counter.decrement();
            }
        }
    }
}
