package org.stagecraft.compiler.frontend.binding;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.MetadataReference;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.concurrent.StageExecutor;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.diagnostics.DiagnosticBag;
import org.stagecraft.compiler.diagnostics.DiagnosticSet;
import org.stagecraft.compiler.syntax.FieldDeclaration;
import org.stagecraft.compiler.syntax.ImportDirective;
import org.stagecraft.compiler.syntax.MethodDeclaration;
import org.stagecraft.compiler.syntax.ParameterDeclaration;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.stagecraft.compiler.syntax.TypeDeclaration;
import org.stagecraft.compiler.syntax.Visibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Binds the declarations of a {@link SourceSet} without compiling any method body.
 * <p>
 * Binding runs in two passes. The declare pass walks all units sequentially and fills the
 * {@link SymbolTable}; the resolve pass checks every unit's imports and signatures against the
 * frozen table and may run in parallel across units when the source set allows a concurrent build.
 * Ordinary semantic errors become diagnostics; binding only throws on programming errors.
 */
public class DeclarationBinder {

    private static final Logger LOG = LoggerFactory.getLogger(DeclarationBinder.class);

    private final Executor executor;

    /**
     * Creates a binder that uses the common fork-join pool for concurrent builds.
     */
    public DeclarationBinder() {
        this(ForkJoinPool.commonPool());
    }

    /**
     * @param executor The pool used for the resolve pass when concurrent builds are enabled.
     */
    public DeclarationBinder(Executor executor) {
        this.executor = executor;
    }

    /**
     * Binds all declarations of the source set. The result depends only on the source set's
     * units, references and options.
     *
     * @param sourceSet The source set to bind.
     * @return The bound state including the declaration diagnostics.
     */
    public BoundDeclarationState bind(SourceSet sourceSet) {
        long start = System.nanoTime();
        List<SourceUnit> units = sourceSet.units();

        SymbolTable symbolTable = new SymbolTable();
        List<DiagnosticBag> declareDiagnostics = declare(units, sourceSet.references(), symbolTable);
        symbolTable.freeze();

        TypeResolver resolver = new TypeResolver(symbolTable);
        List<UnitBinding> resolved = StageExecutor.map(units, unit -> resolveUnit(unit, resolver),
                sourceSet.options().concurrentBuild(), executor);

        List<Diagnostic> all = new ArrayList<>();
        Map<String, Set<ImportDirective>> usedImports = new HashMap<>();
        for (int i = 0; i < units.size(); i++) {
            List<Diagnostic> unitDiagnostics = new ArrayList<>(declareDiagnostics.get(i).getDiagnostics());
            unitDiagnostics.addAll(resolved.get(i).diagnostics().getDiagnostics());
            unitDiagnostics.sort(Comparator.comparing(Diagnostic::location, SourceInfo.BY_POSITION));
            all.addAll(unitDiagnostics);
            usedImports.put(units.get(i).path(), Set.copyOf(resolved.get(i).usedImports()));
        }

        DiagnosticSet diagnostics = DiagnosticSet.of(all);
        LOG.debug("Bound {} source units of '{}' ({} diagnostics, concurrent={}) in {} ms",
                units.size(), sourceSet.assemblyName(), diagnostics.size(),
                sourceSet.options().concurrentBuild(), (System.nanoTime() - start) / 1_000_000);
        return new BoundDeclarationState(sourceSet, symbolTable, diagnostics, usedImports);
    }

    private List<DiagnosticBag> declare(List<SourceUnit> units, Set<MetadataReference> references, SymbolTable symbolTable) {
        symbolTable.declareNamespace("");
        List<DiagnosticBag> bags = new ArrayList<>(units.size());
        for (SourceUnit unit : units) {
            DiagnosticBag bag = new DiagnosticBag();
            symbolTable.declareNamespace(unit.namespace());
            for (TypeDeclaration type : unit.types()) {
                String qualified = SymbolTable.qualify(unit.namespace(), type.name());
                Symbol typeSymbol = new Symbol(type.name(), Symbol.Kind.TYPE, qualified, type.visibility(), type.source(), unit.path());
                if (!symbolTable.defineType(unit.namespace(), typeSymbol, type, bag)) {
                    continue;
                }
                for (FieldDeclaration field : type.fields()) {
                    symbolTable.defineMember(qualified, new Symbol(field.name(), Symbol.Kind.FIELD,
                            qualified + "." + field.name(), field.visibility(), field.source(), unit.path()), bag);
                }
                for (MethodDeclaration method : type.methods()) {
                    symbolTable.defineMember(qualified, new Symbol(method.name(), Symbol.Kind.METHOD,
                            qualified + "." + method.name(), method.visibility(), method.source(), unit.path()), bag);
                }
            }
            bags.add(bag);
        }

        // Source types win over referenced ones; references are visited in name order.
        references.stream()
                .sorted(Comparator.comparing(MetadataReference::name))
                .forEach(reference -> reference.exportedTypes().stream().sorted().forEach(qualified -> {
                    int dot = qualified.lastIndexOf('.');
                    String namespace = dot < 0 ? "" : qualified.substring(0, dot);
                    String name = qualified.substring(dot + 1);
                    symbolTable.defineType(namespace,
                            new Symbol(name, Symbol.Kind.TYPE, qualified, Visibility.PUBLIC, SourceInfo.NONE, reference.name()),
                            null, null);
                }));
        return bags;
    }

    private UnitBinding resolveUnit(SourceUnit unit, TypeResolver resolver) {
        DiagnosticBag bag = new DiagnosticBag();
        Set<ImportDirective> used = new HashSet<>();

        for (ImportDirective imp : unit.imports()) {
            if (!resolver.symbolTable().hasNamespace(imp.namespace())) {
                bag.report(CompilerErrorCode.UNKNOWN_NAMESPACE, imp.source(), imp.namespace());
            }
        }
        for (TypeDeclaration type : unit.types()) {
            if (type.baseType() != null) {
                resolver.resolveOrReport(unit, type.baseType(), type.source(), bag, used);
            }
            for (FieldDeclaration field : type.fields()) {
                resolver.resolveOrReport(unit, field.typeName(), field.source(), bag, used);
            }
            for (MethodDeclaration method : type.methods()) {
                resolver.resolveOrReport(unit, method.returnType(), method.source(), bag, used);
                for (ParameterDeclaration parameter : method.parameters()) {
                    resolver.resolveOrReport(unit, parameter.typeName(), method.source(), bag, used);
                }
            }
        }
        return new UnitBinding(bag, used);
    }

    private record UnitBinding(DiagnosticBag diagnostics, Set<ImportDirective> usedImports) {
    }
}
