package org.stagecraft.compiler.diagnostics;

import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.frontend.analysis.AnalyzerOptions;
import org.stagecraft.compiler.frontend.analysis.CompilationWithAnalyzers;
import org.stagecraft.compiler.frontend.analysis.IDiagnosticAnalyzer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Entry point for diagnostics of a {@link SourceSet}.
 * <p>
 * The plain mode returns the declaration diagnostics and binds the source set first if needed.
 * The analyzer-augmented mode pairs the source set with analyzers and runs them asynchronously.
 */
public class DiagnosticsEngine {

    private final Executor executor;

    public DiagnosticsEngine() {
        this(ForkJoinPool.commonPool());
    }

    /**
     * @param executor The pool analyzer work is scheduled on.
     */
    public DiagnosticsEngine(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Returns all declaration diagnostics. Binding happens at most once per source set, so
     * repeated calls return the same result.
     *
     * @param sourceSet The source set.
     * @return The declaration diagnostics.
     */
    public DiagnosticSet getDiagnostics(SourceSet sourceSet) {
        return sourceSet.boundState().diagnostics();
    }

    /**
     * Pairs a source set with analyzers. Nothing runs until one of the async methods is called.
     *
     * @param sourceSet The source set.
     * @param analyzers The analyzers in registration order.
     * @param options The analyzer configuration.
     * @return The analyzer-augmented compilation.
     */
    public CompilationWithAnalyzers withAnalyzers(SourceSet sourceSet, List<IDiagnosticAnalyzer> analyzers,
                                                  AnalyzerOptions options) {
        return new CompilationWithAnalyzers(sourceSet, analyzers, options, executor);
    }
}
