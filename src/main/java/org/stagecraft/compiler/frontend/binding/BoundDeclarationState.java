package org.stagecraft.compiler.frontend.binding;

import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.diagnostics.DiagnosticSet;
import org.stagecraft.compiler.syntax.ImportDirective;
import org.stagecraft.compiler.syntax.SourceUnit;

import java.util.Map;
import java.util.Set;

/**
 * The cached result of declaration binding for one {@link SourceSet}.
 * <p>
 * Instances are immutable and may be read concurrently by any number of stages and analyzers.
 * They are invalidated only by creating a new source set.
 */
public final class BoundDeclarationState {

    private final SourceSet sourceSet;
    private final SymbolTable symbolTable;
    private final TypeResolver resolver;
    private final DiagnosticSet diagnostics;
    private final Map<String, Set<ImportDirective>> usedImportsByUnit;

    BoundDeclarationState(SourceSet sourceSet, SymbolTable symbolTable, DiagnosticSet diagnostics,
                          Map<String, Set<ImportDirective>> usedImportsByUnit) {
        this.sourceSet = sourceSet;
        this.symbolTable = symbolTable;
        this.resolver = new TypeResolver(symbolTable);
        this.diagnostics = diagnostics;
        this.usedImportsByUnit = Map.copyOf(usedImportsByUnit);
    }

    /**
     * @return The source set this state was bound from.
     */
    public SourceSet sourceSet() {
        return sourceSet;
    }

    /**
     * @return The frozen declaration table.
     */
    public SymbolTable symbolTable() {
        return symbolTable;
    }

    /**
     * @return A resolver over the declaration table, for method compilation and analyzers.
     */
    public TypeResolver resolver() {
        return resolver;
    }

    /**
     * @return The declaration diagnostics, units in source set order and each unit in source order.
     */
    public DiagnosticSet diagnostics() {
        return diagnostics;
    }

    /**
     * Resolves a type name as seen from a unit. Does not change any state.
     *
     * @param unit The unit containing the reference.
     * @param name The type name as written.
     * @return The resolution.
     */
    public TypeResolution resolveType(SourceUnit unit, String name) {
        return resolver.resolve(unit, name);
    }

    /**
     * @return {@code true} if binding reported at least one error.
     */
    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }

    /**
     * @param unit A unit of the source set.
     * @return The imports that declaration signatures of the unit needed.
     */
    public Set<ImportDirective> usedImports(SourceUnit unit) {
        return usedImportsByUnit.getOrDefault(unit.path(), Set.of());
    }
}
