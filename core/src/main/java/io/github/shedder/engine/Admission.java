package io.github.shedder.engine;

import io.github.shedder.aggregator.RequestObserver;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outcome of {@link DecisionEngine#admit()}.
 *
 * <p>An accepted admission carries one open sample per request-fed aggregator. Close it once the
 * handler returns, on every exit path:</p>
 * <pre>{@code
 * try (Admission admission = engine.admit()) {
 *     if (!admission.isAccepted()) {
 *         return reject();
 *     }
 *     return handler.handle(request);
 * }
 * }</pre>
 */
public final class Admission implements AutoCloseable {

    private static final Admission REJECTED = new Admission(Decision.REJECT, List.of());

    private final Decision decision;
    private final List<RequestObserver.Sample> samples;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Admission(Decision decision, List<RequestObserver.Sample> samples) {
        this.decision = decision;
        this.samples = samples;
    }

    static Admission accepted(List<RequestObserver.Sample> samples) {
        return new Admission(Decision.ACCEPT, List.copyOf(samples));
    }

    static Admission rejected() {
        return REJECTED;
    }

    public Decision decision() {
        return decision;
    }

    public boolean isAccepted() {
        return decision.isAccepted();
    }

    /**
     * Report completion to every aggregator that observed the request. Later calls do nothing.
     */
    @Override
    public void close() {
        if (samples.isEmpty() || !closed.compareAndSet(false, true)) {
            return;
        }
        RuntimeException failure = null;
        for (int i = samples.size() - 1; i >= 0; i--) {
            try {
                samples.get(i).close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
