package org.stagecraft.compiler.backend.emit;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.InvalidPipelineStateException;
import org.stagecraft.compiler.api.ManifestResource;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Completes a module after method compilation: attaches manifest resources, generates
 * documentation, reports unused imports and seals the module.
 * <p>
 * Diagnostics are appended to the module. Finalizing a module twice is an invalid-state error.
 */
public class ModuleFinalizer {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleFinalizer.class);

    private final DocumentationGenerator documentationGenerator = new DocumentationGenerator();
    private final UnusedImportReporter unusedImportReporter = new UnusedImportReporter();

    /**
     * Finalizes the module without resources.
     * @param module The module.
     * @return The same module, now {@link ModuleState#FINALIZED}.
     */
    public ModuleBuildState finalizeModule(ModuleBuildState module) {
        return finalizeModule(module, List.of());
    }

    /**
     * Finalizes the module.
     *
     * @param module The open module whose methods have been compiled.
     * @param resources The manifest resources to attach, in order.
     * @return The same module, now {@link ModuleState#FINALIZED}.
     * @throws InvalidPipelineStateException if the module is in use by another stage, is not open,
     *         methods were not compiled yet, or method compilation was blocked by declaration errors.
     */
    public ModuleBuildState finalizeModule(ModuleBuildState module, List<ManifestResource> resources) {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(resources, "resources");
        String operation = "finalize module";
        try (ModuleBuildState.StageAccess access = module.enter(operation)) {
            return finalizeHeld(module, resources, operation);
        }
    }

    private ModuleBuildState finalizeHeld(ModuleBuildState module, List<ManifestResource> resources, String operation) {
        module.requireState(ModuleState.OPEN, operation);
        if (module.compilationBlocked()) {
            throw new InvalidPipelineStateException(operation, "methods were not compiled: declaration errors under FAIL_CLOSED");
        }
        if (!module.methodsCompiled()) {
            throw new InvalidPipelineStateException(operation, "methods of this module have not been compiled");
        }

        long start = System.nanoTime();
        List<Diagnostic> diagnostics = new ArrayList<>();

        // Phase 1: resources
        for (ManifestResource resource : resources) {
            if (!module.addResource(resource)) {
                diagnostics.add(Diagnostic.of(CompilerErrorCode.DUPLICATE_RESOURCE, SourceInfo.NONE, resource.name()));
            }
        }

        // Phase 2: documentation
        if (module.options().generateDocumentation()) {
            module.setDocumentation(documentationGenerator.generate(module));
        }

        // Phase 3: unused imports. Without lowered bodies, body usage is unknown.
        if (module.bodiesLowered()) {
            diagnostics.addAll(unusedImportReporter.report(module));
        }

        module.addDiagnostics(diagnostics);
        module.seal();
        LOG.debug("Finalized module '{}' ({} resources, documentation={}) in {} ms",
                module.moduleName(), module.resources().size(), module.documentation().isPresent(),
                (System.nanoTime() - start) / 1_000_000);
        return module;
    }
}
