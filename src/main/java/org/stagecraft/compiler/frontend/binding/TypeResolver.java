package org.stagecraft.compiler.frontend.binding;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.diagnostics.DiagnosticBag;
import org.stagecraft.compiler.syntax.ImportDirective;
import org.stagecraft.compiler.syntax.SourceUnit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves type names against a frozen {@link SymbolTable}.
 * <p>
 * Lookup order: builtin types, qualified names, the unit's own namespace, then every imported
 * namespace. The resolver never mutates shared state and may be used from many threads.
 */
public class TypeResolver {

    private final SymbolTable symbolTable;

    /**
     * @param symbolTable A frozen symbol table.
     */
    public TypeResolver(SymbolTable symbolTable) {
        if (!symbolTable.isFrozen()) {
            throw new IllegalArgumentException("Type resolution requires a frozen symbol table");
        }
        this.symbolTable = symbolTable;
    }

    /**
     * Resolves a type name as seen from the given unit.
     * @param unit The unit containing the reference.
     * @param name The type name as written.
     * @return The resolution.
     */
    public TypeResolution resolve(SourceUnit unit, String name) {
        Optional<Symbol> builtin = SymbolTable.builtin(name);
        if (builtin.isPresent()) {
            return TypeResolution.resolved(builtin.get(), null);
        }
        if (name.indexOf('.') > 0) {
            return symbolTable.lookupQualified(name)
                    .map(s -> TypeResolution.resolved(s, null))
                    .orElseGet(TypeResolution::notFound);
        }
        Optional<Symbol> own = symbolTable.lookupType(unit.namespace(), name);
        if (own.isPresent()) {
            return TypeResolution.resolved(own.get(), null);
        }

        // First import wins when the same namespace is imported more than once.
        Map<String, ImportDirective> matches = new LinkedHashMap<>();
        Map<String, Symbol> symbols = new LinkedHashMap<>();
        for (ImportDirective imp : unit.imports()) {
            symbolTable.lookupType(imp.namespace(), name).ifPresent(s -> {
                matches.putIfAbsent(s.qualifiedName(), imp);
                symbols.putIfAbsent(s.qualifiedName(), s);
            });
        }
        if (matches.isEmpty()) {
            return TypeResolution.notFound();
        }
        if (matches.size() > 1) {
            return TypeResolution.ambiguous(new ArrayList<>(matches.keySet()));
        }
        String qualified = matches.keySet().iterator().next();
        return TypeResolution.resolved(symbols.get(qualified), matches.get(qualified));
    }

    /**
     * Resolves a type name, reporting failures and recording the import that was used.
     *
     * @param unit The unit containing the reference.
     * @param name The type name as written.
     * @param location Where the reference occurs.
     * @param diagnostics Receives {@code SC0104} or {@code SC0105} on failure.
     * @param usedImports Receives the import that made the type visible.
     * @return The resolved symbol, or empty if resolution failed.
     */
    public Optional<Symbol> resolveOrReport(SourceUnit unit, String name, SourceInfo location,
                                            DiagnosticBag diagnostics, Set<ImportDirective> usedImports) {
        TypeResolution resolution = resolve(unit, name);
        if (resolution.isAmbiguous()) {
            diagnostics.report(CompilerErrorCode.AMBIGUOUS_REFERENCE, location, name, String.join(" and ", resolution.candidates()));
            return Optional.empty();
        }
        if (!resolution.isResolved()) {
            diagnostics.report(CompilerErrorCode.UNDECLARED_IDENTIFIER, location, name);
            return Optional.empty();
        }
        if (resolution.viaImport() != null) {
            usedImports.add(resolution.viaImport());
        }
        return Optional.of(resolution.symbol());
    }

    /**
     * @return The table this resolver reads from.
     */
    public SymbolTable symbolTable() {
        return symbolTable;
    }
}
