package org.stagecraft.compiler.frontend.analysis;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.concurrent.CancellationToken;
import org.stagecraft.compiler.concurrent.CancellationTokenSource;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.diagnostics.DiagnosticSet;
import org.stagecraft.compiler.frontend.binding.BoundDeclarationState;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * A source set paired with a fixed list of analyzers: the analyzer-augmented mode of the
 * diagnostics engine.
 * <p>
 * Analyzers run in parallel with each other, and across units for analyzers that declare
 * {@link IDiagnosticAnalyzer#supportsConcurrentUnits()}, when the source set allows a concurrent
 * build. The result is ordered deterministically regardless of completion order: declaration
 * diagnostics first, then one group per analyzer in registration order, units in source set order.
 * <p>
 * A run is cancelled through its {@link CancellationToken} or by cancelling the returned future.
 * A cancelled run never completes normally, so a partial result is never reported as complete.
 */
public class CompilationWithAnalyzers {

    private static final Logger LOG = LoggerFactory.getLogger(CompilationWithAnalyzers.class);

    private final SourceSet sourceSet;
    private final List<IDiagnosticAnalyzer> analyzers;
    private final AnalyzerOptions options;
    private final Executor executor;

    /**
     * @param sourceSet The source set to analyze.
     * @param analyzers The analyzers, in registration order.
     * @param options The analyzer configuration.
     * @param executor The pool analyzer work is scheduled on.
     */
    public CompilationWithAnalyzers(SourceSet sourceSet, List<IDiagnosticAnalyzer> analyzers,
                                    AnalyzerOptions options, Executor executor) {
        this.sourceSet = Objects.requireNonNull(sourceSet, "sourceSet");
        this.analyzers = List.copyOf(analyzers);
        this.options = Objects.requireNonNull(options, "options");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Returns declaration diagnostics merged with the diagnostics of all analyzers.
     *
     * @param cancellationToken Cancels the run.
     * @return A future completing with the merged set, or cancelled.
     */
    public CompletableFuture<DiagnosticSet> getAllDiagnosticsAsync(CancellationToken cancellationToken) {
        return run(cancellationToken, true);
    }

    /**
     * Returns only the analyzer diagnostics.
     *
     * @param cancellationToken Cancels the run.
     * @return A future completing with the analyzer diagnostics, or cancelled.
     */
    public CompletableFuture<DiagnosticSet> getAnalyzerDiagnosticsAsync(CancellationToken cancellationToken) {
        return run(cancellationToken, false);
    }

    public SourceSet sourceSet() {
        return sourceSet;
    }

    public List<IDiagnosticAnalyzer> analyzers() {
        return analyzers;
    }

    private CompletableFuture<DiagnosticSet> run(CancellationToken cancellationToken, boolean includeDeclarations) {
        CancellationTokenSource linked = CancellationTokenSource.linkedTo(cancellationToken);
        CompletableFuture<DiagnosticSet> result = new CompletableFuture<>();
        linked.token().register(() -> result.cancel(false));
        result.whenComplete((r, t) -> {
            if (result.isCancelled()) {
                linked.cancel();
            }
            linked.close();
        });
        if (result.isDone()) {
            return result;
        }

        CancellationToken token = linked.token();
        CompletableFuture.supplyAsync(sourceSet::boundState, executor)
                .thenCompose(bound -> runAnalyzers(bound, token)
                        .thenApply(analyzerDiagnostics -> includeDeclarations
                                ? bound.diagnostics().concat(analyzerDiagnostics)
                                : analyzerDiagnostics))
                .whenComplete((diagnostics, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                        if (cause instanceof CancellationException) {
                            result.cancel(false);
                        } else {
                            result.completeExceptionally(cause);
                        }
                    } else if (token.isCancellationRequested()) {
                        result.cancel(false);
                    } else {
                        result.complete(diagnostics);
                    }
                });
        return result;
    }

    private CompletableFuture<DiagnosticSet> runAnalyzers(BoundDeclarationState bound, CancellationToken token) {
        long start = System.nanoTime();
        boolean concurrent = sourceSet.options().concurrentBuild();

        List<CompletableFuture<List<Diagnostic>>> perAnalyzer = new ArrayList<>(analyzers.size());
        if (concurrent) {
            for (IDiagnosticAnalyzer analyzer : analyzers) {
                perAnalyzer.add(runAnalyzer(analyzer, bound, token));
            }
        } else {
            CompletableFuture<List<Diagnostic>> previous = CompletableFuture.completedFuture(List.of());
            for (IDiagnosticAnalyzer analyzer : analyzers) {
                previous = previous.thenApplyAsync(ignored -> analyzeUnitsSequentially(analyzer, bound, token), executor);
                perAnalyzer.add(previous);
            }
        }

        return CompletableFuture.allOf(perAnalyzer.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    token.throwIfCancellationRequested();
                    List<Diagnostic> merged = new ArrayList<>();
                    for (CompletableFuture<List<Diagnostic>> future : perAnalyzer) {
                        merged.addAll(future.join());
                    }
                    LOG.debug("Ran {} analyzers over {} units (concurrent={}) in {} ms",
                            analyzers.size(), sourceSet.units().size(), concurrent, (System.nanoTime() - start) / 1_000_000);
                    return DiagnosticSet.of(merged);
                });
    }

    private CompletableFuture<List<Diagnostic>> runAnalyzer(IDiagnosticAnalyzer analyzer, BoundDeclarationState bound,
                                                            CancellationToken token) {
        if (!analyzer.supportsConcurrentUnits()) {
            return CompletableFuture.supplyAsync(() -> analyzeUnitsSequentially(analyzer, bound, token), executor);
        }
        List<CompletableFuture<List<Diagnostic>>> perUnit = new ArrayList<>();
        for (SourceUnit unit : sourceSet.units()) {
            perUnit.add(CompletableFuture.supplyAsync(() -> analyzeUnit(analyzer, unit, bound, token), executor));
        }
        return CompletableFuture.allOf(perUnit.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<Diagnostic> merged = new ArrayList<>();
                    perUnit.forEach(f -> merged.addAll(f.join()));
                    return merged;
                });
    }

    private List<Diagnostic> analyzeUnitsSequentially(IDiagnosticAnalyzer analyzer, BoundDeclarationState bound,
                                                      CancellationToken token) {
        List<Diagnostic> merged = new ArrayList<>();
        for (SourceUnit unit : sourceSet.units()) {
            merged.addAll(analyzeUnit(analyzer, unit, bound, token));
        }
        return merged;
    }

    private List<Diagnostic> analyzeUnit(IDiagnosticAnalyzer analyzer, SourceUnit unit, BoundDeclarationState bound,
                                         CancellationToken token) {
        token.throwIfCancellationRequested();
        List<Diagnostic> reported;
        try {
            reported = analyzer.analyze(new AnalysisContext(bound, unit, options, token));
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Analyzer '{}' failed on '{}'", analyzer.id(), unit.path(), e);
            return List.of(Diagnostic.of(CompilerErrorCode.ANALYZER_FAILED,
                    new SourceInfo(unit.path(), 0, 0), analyzer.id(), String.valueOf(e.getMessage())));
        }
        List<Diagnostic> effective = new ArrayList<>(reported.size());
        for (Diagnostic diagnostic : reported) {
            options.applySeverity(diagnostic).ifPresent(effective::add);
        }
        return effective;
    }
}
