package org.stagecraft.compiler.concurrent;

/**
 * Issues a {@link CancellationToken} and requests its cancellation.
 * <p>
 * A linked source holds a callback on its parent token until it is closed.
 */
public final class CancellationTokenSource implements AutoCloseable {

    private final CancellationToken token = new CancellationToken();
    private volatile CancellationRegistration parentRegistration = CancellationRegistration.EMPTY;

    /**
     * Creates a source whose token is also cancelled when {@code parent} is cancelled.
     * Close the source when the linked work has completed.
     *
     * @param parent The outer token.
     * @return The linked source.
     */
    public static CancellationTokenSource linkedTo(CancellationToken parent) {
        CancellationTokenSource source = new CancellationTokenSource();
        source.parentRegistration = parent.register(source::cancel);
        return source;
    }

    /**
     * @return The token observed by the cancellable work.
     */
    public CancellationToken token() {
        return token;
    }

    /**
     * Requests cancellation. Idempotent.
     */
    public void cancel() {
        token.cancel();
    }

    /**
     * Detaches this source from its parent token. The own token keeps its state.
     */
    @Override
    public void close() {
        parentRegistration.close();
    }
}
