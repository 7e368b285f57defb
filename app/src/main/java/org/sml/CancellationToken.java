package org.sml;

import java.util.concurrent.CancellationException;

/**
 * Flag shared between a caller and a running parse or reduction. Once
 * cancelled, the next token retrieval or reduction step throws
 * {@link CancellationException}.
 */
public final class CancellationToken {
    private volatile boolean cancelled = false;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    void throwIfCancelled(String stage) {
        if (cancelled) {
            throw new CancellationException(stage + " cancelled");
        }
    }
}
