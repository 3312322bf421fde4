package im.arun.jsonnav.util;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag checked by long-running operations at batch boundaries.
 */
public final class CancellationSignal {
    private volatile boolean cancelled;

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Operation cancelled");
        }
    }
}
