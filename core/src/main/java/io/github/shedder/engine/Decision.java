package io.github.shedder.engine;

/**
 * Verdict for one request.
 */
public enum Decision {
    /** Dispatch to the wrapped handler. */
    ACCEPT,

    /** Answer with the rejection handler instead. */
    REJECT;

    public boolean isAccepted() {
        return this == ACCEPT;
    }
}
