package org.stagecraft.compiler.frontend.analysis;

import org.stagecraft.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An external, pluggable component that inspects bound declarations and reports additional diagnostics.
 * <p>
 * Analyzers receive read-only state only, must not mutate shared state and must be safe to run
 * concurrently with other analyzers. Suppressing duplicates among their own diagnostics is up to them.
 */
public interface IDiagnosticAnalyzer {

    /**
     * @return A stable identifier, used in logs and in failure diagnostics.
     */
    String id();

    /**
     * Declares whether {@link #analyze(AnalysisContext)} may run for several units at the same time.
     * @return {@code true} if per-unit invocations are independent.
     */
    default boolean supportsConcurrentUnits() {
        return false;
    }

    /**
     * Analyzes one source unit.
     * Long-running analyzers should poll {@link AnalysisContext#cancellationToken()}.
     *
     * @param context The unit, the bound declarations and the analyzer options.
     * @return The diagnostics found in the unit, in source order.
     */
    List<Diagnostic> analyze(AnalysisContext context);
}
