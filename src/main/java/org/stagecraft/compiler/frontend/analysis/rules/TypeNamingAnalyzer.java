package org.stagecraft.compiler.frontend.analysis.rules;

import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.frontend.analysis.AnalysisContext;
import org.stagecraft.compiler.frontend.analysis.IDiagnosticAnalyzer;
import org.stagecraft.compiler.syntax.TypeDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports type names that are not PascalCase ({@code SCA001}).
 * Looks at one unit at a time, so units may be analyzed concurrently.
 */
public class TypeNamingAnalyzer implements IDiagnosticAnalyzer {

    public static final String ID = "SCA001";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean supportsConcurrentUnits() {
        return true;
    }

    @Override
    public List<Diagnostic> analyze(AnalysisContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (TypeDeclaration type : context.unit().types()) {
            context.cancellationToken().throwIfCancellationRequested();
            if (!isPascalCase(type.name())) {
                diagnostics.add(new Diagnostic(Diagnostic.Severity.WARNING, ID,
                        String.format("Type name '%s' should be PascalCase", type.name()), type.source()));
            }
        }
        return diagnostics;
    }

    static boolean isPascalCase(String name) {
        if (name.isEmpty() || !Character.isUpperCase(name.charAt(0))) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!Character.isLetterOrDigit(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
