package io.github.shedder.aggregator;

/**
 * Aggregator capability for signals fed by the requests themselves (latency, in-flight count).
 *
 * <pre>{@code
 * try (RequestObserver.Sample sample = observer.begin()) {
 *     handler.handle(request);
 * } // completion recorded on every exit path
 * }</pre>
 */
public interface RequestObserver {

    /**
     * Called right before an accepted request is dispatched.
     *
     * @return a sample that must be closed once the request completes
     */
    Sample begin();

    /**
     * Completion handle for one request. Closing more than once has no further effect.
     */
    interface Sample extends AutoCloseable {
        @Override
        void close();  // No exception declared
    }
}
