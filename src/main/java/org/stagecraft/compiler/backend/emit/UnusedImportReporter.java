package org.stagecraft.compiler.backend.emit;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.frontend.binding.BoundDeclarationState;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.syntax.ImportDirective;
import org.stagecraft.compiler.syntax.SourceUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reports imports that neither declaration signatures nor compiled method bodies needed.
 * Imports of unknown namespaces are skipped; binding already reported them.
 */
class UnusedImportReporter {

    List<Diagnostic> report(ModuleBuildState module) {
        BoundDeclarationState bound = module.sourceSet().boundState();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SourceUnit unit : module.sourceSet().units()) {
            Set<ImportDirective> byDeclarations = bound.usedImports(unit);
            Set<ImportDirective> byBodies = module.methodImports(unit.path());
            for (ImportDirective imp : unit.imports()) {
                if (!bound.symbolTable().hasNamespace(imp.namespace())) {
                    continue;
                }
                if (!byDeclarations.contains(imp) && !byBodies.contains(imp)) {
                    diagnostics.add(Diagnostic.of(CompilerErrorCode.UNUSED_IMPORT, imp.source(), imp.namespace()));
                }
            }
        }
        return diagnostics;
    }
}
