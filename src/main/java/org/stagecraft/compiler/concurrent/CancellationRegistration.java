package org.stagecraft.compiler.concurrent;

/**
 * Handle for a callback registered on a {@link CancellationToken}. Closing it removes the
 * callback if it has not run yet.
 */
public final class CancellationRegistration implements AutoCloseable {

    static final CancellationRegistration EMPTY = new CancellationRegistration(null, null);

    private final CancellationToken token;
    private final Runnable callback;

    CancellationRegistration(CancellationToken token, Runnable callback) {
        this.token = token;
        this.callback = callback;
    }

    /**
     * Unregisters the callback. Idempotent.
     */
    @Override
    public void close() {
        if (token != null) {
            token.unregister(callback);
        }
    }
}
