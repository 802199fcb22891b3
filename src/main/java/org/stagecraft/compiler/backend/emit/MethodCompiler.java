package org.stagecraft.compiler.backend.emit;

import org.stagecraft.compiler.api.EmissionPolicy;
import org.stagecraft.compiler.api.InvalidPipelineStateException;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.backend.lower.LoweringRegistry;
import org.stagecraft.compiler.backend.lower.MethodLowerer;
import org.stagecraft.compiler.backend.lower.MethodLoweringResult;
import org.stagecraft.compiler.concurrent.StageExecutor;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.diagnostics.DiagnosticSet;
import org.stagecraft.compiler.frontend.binding.BoundDeclarationState;
import org.stagecraft.compiler.frontend.binding.SymbolTable;
import org.stagecraft.compiler.syntax.MethodDeclaration;
import org.stagecraft.compiler.syntax.SourceUnit;
import org.stagecraft.compiler.syntax.TypeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Compiles the method bodies of a bound {@link SourceSet} into an open {@link ModuleBuildState}.
 * <p>
 * Methods are lowered independently, in parallel when the source set allows a concurrent build.
 * Results are added to the module on the calling thread in unit, type and method order, so the
 * module content does not depend on the concurrency mode.
 */
public class MethodCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(MethodCompiler.class);

    private final Executor executor;

    public MethodCompiler() {
        this(ForkJoinPool.commonPool());
    }

    /**
     * @param executor The pool methods are lowered on when concurrent builds are enabled.
     */
    public MethodCompiler(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Compiles all method bodies.
     *
     * @param sourceSet The bound source set.
     * @param module The open module created for {@code sourceSet}.
     * @return The module, the success flag and the diagnostics of binding and method compilation.
     * @throws InvalidPipelineStateException if the source set is not bound, the module belongs to another
     *         source set, is in use by another stage, is not open, or already had its methods compiled.
     */
    public MethodCompilationResult compileMethods(SourceSet sourceSet, ModuleBuildState module) {
        Objects.requireNonNull(sourceSet, "sourceSet");
        Objects.requireNonNull(module, "module");
        String operation = "compile methods";
        if (!sourceSet.isBound()) {
            throw new InvalidPipelineStateException(operation, "declarations of '" + sourceSet.assemblyName() + "' have not been bound");
        }
        if (module.sourceSet() != sourceSet) {
            throw new InvalidPipelineStateException(operation, "the module was opened for a different source set");
        }
        try (ModuleBuildState.StageAccess access = module.enter(operation)) {
            return compile(sourceSet, module, operation);
        }
    }

    private MethodCompilationResult compile(SourceSet sourceSet, ModuleBuildState module, String operation) {
        module.requireState(ModuleState.OPEN, operation);
        if (module.methodsCompiled()) {
            throw new InvalidPipelineStateException(operation, "methods of this module have already been compiled");
        }

        long start = System.nanoTime();
        BoundDeclarationState bound = sourceSet.boundState();
        DiagnosticSet declarationDiagnostics = bound.diagnostics();

        if (bound.hasErrors() && module.options().emissionPolicy() == EmissionPolicy.FAIL_CLOSED) {
            LOG.info("Skipping method compilation of '{}': {} declaration errors under {}",
                    sourceSet.assemblyName(), declarationDiagnostics.errors().size(), EmissionPolicy.FAIL_CLOSED);
            module.markCompilationBlocked();
            return new MethodCompilationResult(module, false, declarationDiagnostics);
        }
        if (bound.hasErrors()) {
            LOG.warn("Compiling methods of '{}' despite {} declaration errors ({})",
                    sourceSet.assemblyName(), declarationDiagnostics.errors().size(), EmissionPolicy.EMIT_ANYWAY);
        }
        if (module.options().emitMetadataOnly()) {
            LOG.debug("Metadata-only emit of '{}': method bodies are not lowered", sourceSet.assemblyName());
            module.markMethodsCompiled(false);
            return new MethodCompilationResult(module, !bound.hasErrors(), declarationDiagnostics);
        }

        List<MethodJob> jobs = collectJobs(sourceSet, bound);
        MethodLowerer lowerer = new MethodLowerer(LoweringRegistry.initializeWithDefaults(module.options()));
        List<MethodLoweringResult> results = StageExecutor.map(jobs,
                job -> lowerer.lower(job.unit(), job.type(), job.method(), bound),
                sourceSet.options().concurrentBuild(), executor);

        // Jobs are in unit order; each unit's diagnostics are sorted by position.
        List<Diagnostic> methodDiagnostics = new ArrayList<>();
        List<Diagnostic> unitDiagnostics = new ArrayList<>();
        SourceUnit currentUnit = null;
        int compiled = 0;
        for (int i = 0; i < jobs.size(); i++) {
            MethodJob job = jobs.get(i);
            MethodLoweringResult result = results.get(i);
            if (job.unit() != currentUnit) {
                flushUnit(unitDiagnostics, methodDiagnostics);
                currentUnit = job.unit();
            }
            unitDiagnostics.addAll(result.diagnostics().asList());
            module.recordMethodImports(job.unit().path(), result.usedImports());
            if (result.succeeded()) {
                module.addMethod(result.method());
                compiled++;
            }
        }
        flushUnit(unitDiagnostics, methodDiagnostics);

        module.markMethodsCompiled(true);
        module.addDiagnostics(methodDiagnostics);
        DiagnosticSet methodSet = DiagnosticSet.of(methodDiagnostics);
        boolean success = !bound.hasErrors() && !methodSet.hasErrors();
        LOG.debug("Compiled {}/{} methods of '{}' (concurrent={}) in {} ms",
                compiled, jobs.size(), sourceSet.assemblyName(), sourceSet.options().concurrentBuild(),
                (System.nanoTime() - start) / 1_000_000);
        return new MethodCompilationResult(module, success, declarationDiagnostics.concat(methodSet));
    }

    private static void flushUnit(List<Diagnostic> unitDiagnostics, List<Diagnostic> into) {
        unitDiagnostics.sort(Comparator.comparing(Diagnostic::location, SourceInfo.BY_POSITION));
        into.addAll(unitDiagnostics);
        unitDiagnostics.clear();
    }

    private static List<MethodJob> collectJobs(SourceSet sourceSet, BoundDeclarationState bound) {
        SymbolTable table = bound.symbolTable();
        List<MethodJob> jobs = new ArrayList<>();
        for (SourceUnit unit : sourceSet.units()) {
            for (TypeDeclaration type : unit.types()) {
                String qualified = SymbolTable.qualify(unit.namespace(), type.name());
                // Duplicate declarations were rejected during binding and are not compiled.
                if (table.declarationOf(qualified).orElse(null) != type) {
                    continue;
                }
                for (MethodDeclaration method : type.methods()) {
                    boolean declared = table.lookupMember(qualified, method.name())
                            .filter(m -> m.source().equals(method.source()))
                            .isPresent();
                    if (method.hasBody() && declared) {
                        jobs.add(new MethodJob(unit, type, method));
                    }
                }
            }
        }
        return jobs;
    }

    private record MethodJob(SourceUnit unit, TypeDeclaration type, MethodDeclaration method) {
    }
}
