package org.stagecraft.compiler.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the ordering and failure behavior of {@link StageExecutor}.
 */
public class StageExecutorTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /**
     * Verifies that parallel results come back in input order regardless of completion order.
     */
    @Test
    @Tag("unit")
    void parallelResultsKeepInputOrder() {
        List<Integer> items = IntStream.range(0, 50).boxed().toList();
        Set<String> threads = ConcurrentHashMap.newKeySet();

        List<Integer> results = StageExecutor.map(items, i -> {
            threads.add(Thread.currentThread().getName());
            sleepQuietly(ThreadLocalRandom.current().nextInt(3));
            return i * 2;
        }, true, executor);

        assertThat(results).isEqualTo(IntStream.range(0, 50).map(i -> i * 2).boxed().toList());
        assertThat(threads).noneMatch(name -> name.equals(Thread.currentThread().getName()));
    }

    /**
     * Verifies that sequential mode runs on the calling thread.
     */
    @Test
    @Tag("unit")
    void sequentialRunsInline() {
        String caller = Thread.currentThread().getName();

        List<String> results = StageExecutor.map(List.of(1, 2, 3), i -> Thread.currentThread().getName(), false, executor);

        assertThat(results).containsOnly(caller);
    }

    /**
     * Verifies that a failing item surfaces its original exception.
     */
    @Test
    @Tag("unit")
    void failuresAreUnwrapped() {
        assertThatThrownBy(() -> StageExecutor.map(List.of(1, 2, 3), i -> {
            if (i == 2) {
                throw new IllegalStateException("boom");
            }
            return i;
        }, true, executor)).isInstanceOf(IllegalStateException.class).hasMessage("boom");
    }

    private static void sleepQuietly(int millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
