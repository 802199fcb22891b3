package org.stagecraft.compiler.frontend.analysis;

import org.stagecraft.compiler.concurrent.CancellationToken;
import org.stagecraft.compiler.frontend.binding.BoundDeclarationState;
import org.stagecraft.compiler.syntax.SourceUnit;

/**
 * Everything an analyzer may look at for one invocation.
 *
 * @param boundState The shared, read-only declaration state.
 * @param unit The unit to analyze.
 * @param options The analyzer configuration.
 * @param cancellationToken Signals that the run was cancelled.
 */
public record AnalysisContext(
        BoundDeclarationState boundState,
        SourceUnit unit,
        AnalyzerOptions options,
        CancellationToken cancellationToken
) {
}
