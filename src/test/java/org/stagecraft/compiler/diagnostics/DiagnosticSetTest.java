package org.stagecraft.compiler.diagnostics;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the immutable {@link DiagnosticSet} and its collector {@link DiagnosticBag}.
 */
public class DiagnosticSetTest {

    private static Diagnostic warning(String file, int line) {
        return new Diagnostic(Diagnostic.Severity.WARNING, "W1", "warn", new SourceInfo(file, line, 1));
    }

    /**
     * Verifies that concatenation keeps both operands in order without de-duplication.
     */
    @Test
    @Tag("unit")
    void concatPreservesOrderAndDuplicates() {
        Diagnostic a = warning("a.sc", 1);
        Diagnostic b = warning("b.sc", 1);
        DiagnosticSet left = DiagnosticSet.of(List.of(a, b));
        DiagnosticSet right = DiagnosticSet.of(List.of(a));

        DiagnosticSet merged = left.concat(right);

        assertThat(merged.asList()).containsExactly(a, b, a);
        assertThat(left.size()).isEqualTo(2);
    }

    /**
     * Verifies error detection and location sorting.
     */
    @Test
    @Tag("unit")
    void errorsAndSorting() {
        DiagnosticBag bag = new DiagnosticBag();
        bag.add(warning("b.sc", 3));
        bag.report(CompilerErrorCode.UNDECLARED_IDENTIFIER, new SourceInfo("a.sc", 9, 2), "X");
        bag.add(warning("a.sc", 2));

        DiagnosticSet set = bag.toSet();

        assertThat(set.hasErrors()).isTrue();
        assertThat(set.errors()).hasSize(1);
        assertThat(set.errors().get(0).message()).isEqualTo("The type or namespace name 'X' could not be found");
        assertThat(set.sortedByLocation().stream().map(d -> d.location().toString()).toList())
                .containsExactly("a.sc:2:1", "a.sc:9:2", "b.sc:3:1");
    }

    /**
     * Verifies that a set cannot be modified through its list view.
     */
    @Test
    @Tag("unit")
    void setIsImmutable() {
        DiagnosticBag bag = new DiagnosticBag();
        bag.add(warning("a.sc", 1));
        DiagnosticSet set = bag.toSet();
        bag.add(warning("a.sc", 2));

        assertThat(set.size()).isEqualTo(1);
        assertThatThrownBy(() -> set.asList().add(warning("c.sc", 1)))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(DiagnosticSet.empty().hasErrors()).isFalse();
    }
}
