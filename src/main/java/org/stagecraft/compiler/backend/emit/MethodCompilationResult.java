package org.stagecraft.compiler.backend.emit;

import org.stagecraft.compiler.diagnostics.DiagnosticSet;

/**
 * The outcome of the method compilation stage.
 *
 * @param module The module the methods were compiled into.
 * @param success {@code false} if declaration binding or any method reported an error.
 * @param diagnostics Declaration diagnostics followed by method diagnostics.
 */
public record MethodCompilationResult(ModuleBuildState module, boolean success, DiagnosticSet diagnostics) {
}
