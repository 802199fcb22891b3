package org.stagecraft.compiler.frontend.analysis.rules;

import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.frontend.analysis.AnalysisContext;
import org.stagecraft.compiler.frontend.analysis.IDiagnosticAnalyzer;
import org.stagecraft.compiler.frontend.binding.SymbolTable;
import org.stagecraft.compiler.syntax.MethodDeclaration;
import org.stagecraft.compiler.syntax.TypeDeclaration;
import org.stagecraft.compiler.syntax.Visibility;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports public types and public methods of public types without documentation ({@code SCA002}).
 * <p>
 * Option {@code SCA002.include-methods} ({@code true} by default) controls whether methods are checked.
 */
public class UndocumentedPublicApiAnalyzer implements IDiagnosticAnalyzer {

    public static final String ID = "SCA002";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<Diagnostic> analyze(AnalysisContext context) {
        boolean includeMethods = Boolean.parseBoolean(context.options().getOrDefault(ID + ".include-methods", "true"));
        String namespace = context.unit().namespace();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (TypeDeclaration type : context.unit().types()) {
            context.cancellationToken().throwIfCancellationRequested();
            if (type.visibility() != Visibility.PUBLIC) {
                continue;
            }
            String qualified = SymbolTable.qualify(namespace, type.name());
            if (isBlank(type.documentation())) {
                diagnostics.add(new Diagnostic(Diagnostic.Severity.INFO, ID,
                        String.format("Public type '%s' is not documented", qualified), type.source()));
            }
            if (!includeMethods) {
                continue;
            }
            for (MethodDeclaration method : type.methods()) {
                if (method.visibility() == Visibility.PUBLIC && isBlank(method.documentation())) {
                    diagnostics.add(new Diagnostic(Diagnostic.Severity.INFO, ID,
                            String.format("Public method '%s.%s%s' is not documented", qualified, method.name(), method.signature()),
                            method.source()));
                }
            }
        }
        return diagnostics;
    }

    private static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
