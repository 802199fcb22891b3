package org.stagecraft.compiler;

import org.stagecraft.compiler.api.DebugInfoMode;
import org.stagecraft.compiler.api.EmissionPolicy;
import org.stagecraft.compiler.api.EmitOptions;
import org.stagecraft.compiler.api.EmitStreams;
import org.stagecraft.compiler.api.ICompiler;
import org.stagecraft.compiler.api.ManifestResource;
import org.stagecraft.compiler.api.SerializationResult;
import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.backend.emit.MethodCompilationResult;
import org.stagecraft.compiler.backend.emit.MethodCompiler;
import org.stagecraft.compiler.backend.emit.ModuleBuildState;
import org.stagecraft.compiler.backend.emit.ModuleFinalizer;
import org.stagecraft.compiler.backend.emit.Serializer;
import org.stagecraft.compiler.diagnostics.DiagnosticSet;
import org.stagecraft.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * The main compiler implementation. This class orchestrates the pipeline from a
 * {@link SourceSet} to serialized output for a single emit.
 * <p>
 * Instances hold no per-run state and may be shared. Each emit creates its own module, which
 * is confined to the calling thread.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final DiagnosticsEngine diagnosticsEngine;
    private final MethodCompiler methodCompiler;
    private final ModuleFinalizer finalizer = new ModuleFinalizer();
    private final Serializer serializer = new Serializer();

    public Compiler() {
        this(ForkJoinPool.commonPool());
    }

    /**
     * @param executor The pool methods are lowered on and analyzers run on. Declaration binding
     *        does not use it; it runs on the binder given to {@link SourceSet.Builder#binder}.
     */
    public Compiler(Executor executor) {
        this.diagnosticsEngine = new DiagnosticsEngine(executor);
        this.methodCompiler = new MethodCompiler(executor);
    }

    /**
     * @return The diagnostics engine, e.g. to run analyzers on the same pool.
     */
    public DiagnosticsEngine diagnosticsEngine() {
        return diagnosticsEngine;
    }

    @Override
    public DiagnosticSet getDiagnostics(SourceSet sourceSet) {
        return diagnosticsEngine.getDiagnostics(sourceSet);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Under {@link EmissionPolicy#FAIL_CLOSED} nothing is written if
     * binding or method compilation reported errors.
     */
    @Override
    public SerializationResult emit(SourceSet sourceSet, EmitStreams streams, EmitOptions options,
                                    List<ManifestResource> resources) {
        Objects.requireNonNull(sourceSet, "sourceSet");
        Objects.requireNonNull(streams, "streams");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(resources, "resources");
        validate(streams, options);

        long start = System.nanoTime();

        // Phase 1: declaration diagnostics (binds on first use)
        DiagnosticSet declarationDiagnostics = diagnosticsEngine.getDiagnostics(sourceSet);

        // Phase 2: open module
        ModuleBuildState module = ModuleBuildState.open(sourceSet, options);
        if (module.diagnostics().hasErrors()) {
            LOG.warn("Emit of '{}' stopped: {}", sourceSet.assemblyName(), module.diagnostics().summary());
            return SerializationResult.failed(declarationDiagnostics.concat(module.diagnostics()));
        }

        // Phase 3: method bodies
        MethodCompilationResult compiled = methodCompiler.compileMethods(sourceSet, module);
        if (!compiled.success() && options.emissionPolicy() == EmissionPolicy.FAIL_CLOSED) {
            LOG.info("Emit of '{}' failed closed with {} errors; no output written",
                    sourceSet.assemblyName(), compiled.diagnostics().errors().size());
            return SerializationResult.failed(compiled.diagnostics());
        }

        // Phase 4: resources, documentation, unused imports
        finalizer.finalizeModule(module, resources);

        // Phase 5: serialization
        SerializationResult serialized = serializer.serialize(module, streams);

        DiagnosticSet all = declarationDiagnostics.concat(module.diagnostics()).concat(serialized.diagnostics());
        boolean success = serialized.success() && !all.hasErrors();
        LOG.debug("Emitted '{}' as '{}' (success={}, streams={}) in {} ms", sourceSet.assemblyName(),
                module.moduleName(), success, serialized.streamsWritten(), (System.nanoTime() - start) / 1_000_000);
        return new SerializationResult(success, all, serialized.streamsWritten());
    }

    private static void validate(EmitStreams streams, EmitOptions options) {
        if (streams.debug() != null && options.debugInfoMode() != DebugInfoMode.SEPARATE) {
            throw new IllegalArgumentException("A debug stream requires debug information mode SEPARATE, not " + options.debugInfoMode());
        }
        if (streams.metadata() != null && options.emitMetadataOnly()) {
            throw new IllegalArgumentException("A metadata stream cannot be combined with a metadata-only emit");
        }
        if (options.emitTestCoverageData() && options.emitMetadataOnly()) {
            throw new IllegalArgumentException("Test coverage data cannot be emitted for a metadata-only emit");
        }
    }
}
