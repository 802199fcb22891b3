package org.stagecraft.compiler.api;

import org.stagecraft.compiler.SourceFixtures;
import org.stagecraft.compiler.frontend.binding.BoundDeclarationState;
import org.stagecraft.compiler.frontend.binding.DeclarationBinder;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests construction, derivation and binding memoization of {@link SourceSet}.
 */
public class SourceSetTest {

    /**
     * Verifies that the bound state is computed once and then returned unchanged.
     */
    @Test
    @Tag("unit")
    void boundStateIsComputedOnce() {
        // Arrange
        DeclarationBinder binder = spy(new DeclarationBinder());
        SourceSet sourceSet = SourceSet.builder("App")
                .addUnits(SourceFixtures.validProgram())
                .binder(binder)
                .build();

        // Act
        BoundDeclarationState first = sourceSet.boundState();
        BoundDeclarationState second = sourceSet.boundState();

        // Assert
        assertThat(second).isSameAs(first);
        verify(binder, times(1)).bind(any(SourceSet.class));
    }

    /**
     * Verifies that concurrent first requests wait for a single binding run.
     */
    @Test
    @Tag("unit")
    void concurrentRequestsBindOnce() throws Exception {
        // Arrange
        DeclarationBinder binder = spy(new DeclarationBinder());
        SourceSet sourceSet = SourceSet.builder("App")
                .addUnits(SourceFixtures.validProgram())
                .binder(binder)
                .build();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        // Act
        List<Future<BoundDeclarationState>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return sourceSet.boundState();
                }));
            }
            start.countDown();

            // Assert
            BoundDeclarationState expected = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<BoundDeclarationState> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(expected);
            }
            verify(binder, times(1)).bind(any(SourceSet.class));
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Verifies that a derived source set starts unbound and binds independently.
     */
    @Test
    @Tag("unit")
    void withOptionsReturnsFreshUnboundInstance() {
        // Arrange
        SourceSet original = SourceFixtures.sourceSet(SourceFixtures.validProgram());
        BoundDeclarationState originalState = original.boundState();

        // Act
        SourceSet derived = original.withConcurrentBuild(false);

        // Assert
        assertThat(derived).isNotSameAs(original);
        assertThat(derived.isBound()).isFalse();
        assertThat(derived.options().concurrentBuild()).isFalse();
        assertThat(derived.units()).isEqualTo(original.units());
        assertThat(derived.boundState()).isNotSameAs(originalState);
        assertThat(original.boundState()).isSameAs(originalState);
    }

    /**
     * Verifies that malformed input is rejected at construction.
     */
    @Test
    @Tag("unit")
    void rejectsMalformedInput() {
        SourceUnit unit = SourceFixtures.unit("a.sc", "a").build();
        SourceUnit samePath = SourceFixtures.unit("a.sc", "b").build();
        List<SourceUnit> withNull = new ArrayList<>();
        withNull.add(null);

        assertThatThrownBy(() -> SourceSet.create(" ", List.of(unit), Set.of(), CompilationOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SourceSet.create("App", List.of(unit, samePath), Set.of(), CompilationOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a.sc");
        assertThatThrownBy(() -> SourceSet.create("App", withNull, Set.of(), CompilationOptions.defaults()))
                .isInstanceOf(NullPointerException.class);
    }
}
