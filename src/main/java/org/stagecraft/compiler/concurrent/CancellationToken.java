package org.stagecraft.compiler.concurrent;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Observes cancellation requested through a {@link CancellationTokenSource}.
 * <p>
 * Tokens are threaded through every asynchronous stage invocation. Work items poll
 * {@link #throwIfCancellationRequested()} before they start; orchestrators use
 * {@link #register(Runnable)} to react immediately and close the returned registration when done.
 */
public final class CancellationToken {

    /** A token that is never cancelled. */
    public static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    CancellationToken() {
    }

    /**
     * @return {@code true} once cancellation has been requested.
     */
    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if cancellation has been requested.
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /**
     * Registers a callback that runs once when cancellation is requested. If cancellation was
     * already requested the callback runs immediately on the calling thread.
     *
     * @param callback The callback.
     * @return A handle that removes the callback again; close it once the work is done.
     */
    public CancellationRegistration register(Runnable callback) {
        if (this == NONE) return CancellationRegistration.EMPTY;
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
            return CancellationRegistration.EMPTY;
        }
        return new CancellationRegistration(this, callback);
    }

    void unregister(Runnable callback) {
        callbacks.remove(callback);
    }

    /**
     * @return The number of callbacks waiting for cancellation.
     */
    int registeredCallbacks() {
        return callbacks.size();
    }

    boolean cancel() {
        if (this == NONE || !cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                callback.run();
            }
        }
        return true;
    }
}
