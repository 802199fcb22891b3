package org.stagecraft.compiler.diagnostics;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * An append-only collector for diagnostics reported during a single pass.
 * <p>
 * A bag is owned by one pass on one thread. Parallel passes give every work item its own bag
 * and merge the results in a deterministic order afterwards.
 */
public class DiagnosticBag {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a diagnostic for the given code using its default severity.
     *
     * @param code     The error code.
     * @param location The location of the issue.
     * @param args     The message arguments.
     */
    public void report(CompilerErrorCode code, SourceInfo location, Object... args) {
        diagnostics.add(Diagnostic.of(code, location, args));
    }

    /**
     * Adds an already constructed diagnostic.
     * @param diagnostic The diagnostic.
     */
    public void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    /**
     * Adds all given diagnostics in iteration order.
     * @param all The diagnostics.
     */
    public void addAll(Collection<Diagnostic> all) {
        diagnostics.addAll(all);
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * @return {@code true} if nothing has been reported.
     */
    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return An immutable snapshot of the collected diagnostics.
     */
    public DiagnosticSet toSet() {
        return DiagnosticSet.of(diagnostics);
    }
}
