package org.stagecraft.compiler.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs the independent work items of a synchronous stage, either inline on the calling thread
 * or fanned out to a worker pool, and returns the results in input order.
 * <p>
 * Because results are always collected in input order, a stage that merges them sequentially
 * produces the same output in both modes.
 */
public final class StageExecutor {

    private StageExecutor() {
    }

    /**
     * Applies {@code work} to every item and blocks until all items are done.
     *
     * @param items The work items.
     * @param work The per-item function. Must not touch state shared with other items.
     * @param concurrent Whether items may run in parallel.
     * @param executor The pool used when {@code concurrent} is set.
     * @param <T> The item type.
     * @param <R> The result type.
     * @return The results, index-aligned with {@code items}.
     * @throws RuntimeException the first failure of any item, unwrapped.
     */
    public static <T, R> List<R> map(List<T> items, Function<T, R> work, boolean concurrent, Executor executor) {
        if (!concurrent || items.size() < 2) {
            List<R> results = new ArrayList<>(items.size());
            for (T item : items) {
                results.add(work.apply(item));
            }
            return results;
        }

        List<CompletableFuture<R>> futures = new ArrayList<>(items.size());
        for (T item : items) {
            futures.add(CompletableFuture.supplyAsync(() -> work.apply(item), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
        List<R> results = new ArrayList<>(futures.size());
        for (CompletableFuture<R> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    /**
     * Unwraps the exception carried by a failed future.
     * @param throwable The failure as observed on the future.
     * @return The original runtime exception, or a {@link CompletionException} wrapping a checked cause.
     */
    public static RuntimeException unwrap(Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return new CompletionException(cause);
    }
}
