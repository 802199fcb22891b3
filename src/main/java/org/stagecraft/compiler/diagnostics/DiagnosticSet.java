package org.stagecraft.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An immutable, ordered sequence of diagnostics.
 * <p>
 * Sets are combined by concatenation; the order of both operands is preserved and
 * nothing is de-duplicated.
 */
public final class DiagnosticSet implements Iterable<Diagnostic> {

    private static final DiagnosticSet EMPTY = new DiagnosticSet(List.of());

    private final List<Diagnostic> diagnostics;

    private DiagnosticSet(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * @return The empty set.
     */
    public static DiagnosticSet empty() {
        return EMPTY;
    }

    /**
     * Creates a set holding the given diagnostics in iteration order.
     * @param diagnostics The diagnostics.
     * @return The new set.
     */
    public static DiagnosticSet of(Collection<Diagnostic> diagnostics) {
        return diagnostics.isEmpty() ? EMPTY : new DiagnosticSet(List.copyOf(diagnostics));
    }

    /**
     * Concatenates this set with another one.
     * @param other The diagnostics to append.
     * @return A set with this set's diagnostics followed by {@code other}'s.
     */
    public DiagnosticSet concat(DiagnosticSet other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<Diagnostic> merged = new ArrayList<>(diagnostics.size() + other.size());
        merged.addAll(diagnostics);
        merged.addAll(other.diagnostics);
        return new DiagnosticSet(List.copyOf(merged));
    }

    /**
     * @return {@code true} if at least one diagnostic is an error.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * @return The errors of this set, in order.
     */
    public List<Diagnostic> errors() {
        return filter(Diagnostic::isError).asList();
    }

    /**
     * @param predicate The filter.
     * @return A set with the matching diagnostics, in order.
     */
    public DiagnosticSet filter(Predicate<Diagnostic> predicate) {
        return of(diagnostics.stream().filter(predicate).collect(Collectors.toList()));
    }

    /**
     * Returns the diagnostics ordered by file name, line and column. Used by reporting layers that
     * present results of parallel stages.
     *
     * @return A sorted copy of this set.
     */
    public DiagnosticSet sortedByLocation() {
        return of(diagnostics.stream()
                .sorted(Comparator.comparing((Diagnostic d) -> d.location().fileName())
                        .thenComparingInt(d -> d.location().lineNumber())
                        .thenComparingInt(d -> d.location().columnNumber()))
                .collect(Collectors.toList()));
    }

    public int size() {
        return diagnostics.size();
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    public Diagnostic get(int index) {
        return diagnostics.get(index);
    }

    /**
     * @return The diagnostics as an unmodifiable list.
     */
    public List<Diagnostic> asList() {
        return diagnostics;
    }

    public Stream<Diagnostic> stream() {
        return diagnostics.stream();
    }

    @Override
    public Iterator<Diagnostic> iterator() {
        return diagnostics.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DiagnosticSet other && diagnostics.equals(other.diagnostics);
    }

    @Override
    public int hashCode() {
        return diagnostics.hashCode();
    }

    /**
     * Returns all diagnostics as a single, formatted string.
     *
     * @return One line per diagnostic.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return summary();
    }
}
