package org.stagecraft.compiler.backend.lower;

import org.stagecraft.compiler.diagnostics.DiagnosticSet;
import org.stagecraft.compiler.syntax.ImportDirective;

import java.util.Optional;
import java.util.Set;

/**
 * The outcome of lowering a single method.
 *
 * @param method The compiled method, or {@code null} if lowering reported errors.
 * @param diagnostics The diagnostics of this method, in source order.
 * @param usedImports The imports the body needed to resolve its type references.
 */
public record MethodLoweringResult(CompiledMethod method, DiagnosticSet diagnostics, Set<ImportDirective> usedImports) {

    public MethodLoweringResult {
        usedImports = Set.copyOf(usedImports);
    }

    public Optional<CompiledMethod> compiled() {
        return Optional.ofNullable(method);
    }

    public boolean succeeded() {
        return method != null;
    }
}
