package org.stagecraft.compiler.backend.emit;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.EmitOptions;
import org.stagecraft.compiler.api.InvalidPipelineStateException;
import org.stagecraft.compiler.api.ManifestResource;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.api.SourceSet;
import org.stagecraft.compiler.backend.lower.CompiledMethod;
import org.stagecraft.compiler.diagnostics.Diagnostic;
import org.stagecraft.compiler.diagnostics.DiagnosticSet;
import org.stagecraft.compiler.syntax.ImportDirective;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The module under construction for one emit run.
 * <p>
 * A module may be handed from thread to thread between stages, but only one stage can work on it
 * at a time; a stage that starts while another still holds the module fails with an
 * {@link InvalidPipelineStateException}. The module moves through {@link ModuleState#OPEN},
 * {@link ModuleState#FINALIZED} and {@link ModuleState#SERIALIZED} and never back. Only the
 * stages of this package can change it; everything public is read-only.
 */
public final class ModuleBuildState {

    private static final String ILLEGAL_NAME_CHARS = "/\\:*?\"<>|";

    private final SourceSet sourceSet;
    private final EmitOptions options;
    private final AtomicReference<Thread> activeStage = new AtomicReference<>();
    private final String moduleName;

    private ModuleState state = ModuleState.OPEN;
    private boolean methodsCompiled;
    private boolean bodiesLowered;
    private boolean compilationBlocked;
    private final Map<String, CompiledMethod> methods = new LinkedHashMap<>();
    private final Map<String, ManifestResource> resources = new LinkedHashMap<>();
    private final Map<String, Set<ImportDirective>> methodImports = new HashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private String documentation;

    private ModuleBuildState(SourceSet sourceSet, EmitOptions options, String moduleName) {
        this.sourceSet = sourceSet;
        this.options = options;
        this.moduleName = moduleName;
    }

    /**
     * Opens a new module for a source set.
     * <p>
     * An invalid output name override is reported as {@code SC0001} in the module's diagnostics
     * and the assembly name is used instead; callers are expected to stop on that error.
     *
     * @param sourceSet The source set whose methods will be compiled into the module.
     * @param options The emit options of the run.
     * @return The open module.
     */
    public static ModuleBuildState open(SourceSet sourceSet, EmitOptions options) {
        Objects.requireNonNull(sourceSet, "sourceSet");
        Objects.requireNonNull(options, "options");
        String override = options.outputNameOverride();
        if (override != null && !isValidOutputName(override)) {
            ModuleBuildState module = new ModuleBuildState(sourceSet, options, sourceSet.assemblyName());
            module.diagnostics.add(Diagnostic.of(CompilerErrorCode.INVALID_OUTPUT_NAME, SourceInfo.NONE, override));
            return module;
        }
        return new ModuleBuildState(sourceSet, options, override != null ? override : sourceSet.assemblyName());
    }

    /**
     * @param name A candidate output name.
     * @return {@code true} if the name is usable as a module name.
     */
    public static boolean isValidOutputName(String name) {
        if (name.isBlank() || !name.equals(name.trim()) || ".".equals(name) || "..".equals(name)) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (ILLEGAL_NAME_CHARS.indexOf(c) >= 0 || Character.isISOControl(c)) {
                return false;
            }
        }
        return true;
    }

    public ModuleState state() {
        return state;
    }

    public SourceSet sourceSet() {
        return sourceSet;
    }

    public EmitOptions options() {
        return options;
    }

    /**
     * @return The name written into the image header.
     */
    public String moduleName() {
        return moduleName;
    }

    /**
     * @return {@code true} once method compilation has run for this module.
     */
    public boolean methodsCompiled() {
        return methodsCompiled;
    }

    /**
     * @return {@code true} if method compilation actually lowered bodies, as opposed to skipping them.
     */
    public boolean bodiesLowered() {
        return bodiesLowered;
    }

    /**
     * @return {@code true} if method compilation refused to run because of declaration errors
     *         under {@link org.stagecraft.compiler.api.EmissionPolicy#FAIL_CLOSED}. Such a module cannot be finalized.
     */
    public boolean compilationBlocked() {
        return compilationBlocked;
    }

    /**
     * @return The compiled methods in compilation order.
     */
    public Collection<CompiledMethod> methods() {
        return Collections.unmodifiableCollection(methods.values());
    }

    public Optional<CompiledMethod> method(String key) {
        return Optional.ofNullable(methods.get(key));
    }

    /**
     * @return The attached manifest resources in attachment order.
     */
    public Collection<ManifestResource> resources() {
        return Collections.unmodifiableCollection(resources.values());
    }

    /**
     * @return The generated documentation, if documentation was requested and finalization ran.
     */
    public Optional<String> documentation() {
        return Optional.ofNullable(documentation);
    }

    /**
     * @return The diagnostics reported on this module, in the order the stages reported them.
     */
    public DiagnosticSet diagnostics() {
        return DiagnosticSet.of(diagnostics);
    }

    /**
     * @param unitPath A unit path.
     * @return The imports needed by compiled method bodies of that unit.
     */
    public Set<ImportDirective> methodImports(String unitPath) {
        return Collections.unmodifiableSet(methodImports.getOrDefault(unitPath, Set.of()));
    }

    @Override
    public String toString() {
        return "ModuleBuildState[" + moduleName + ", " + state + ", methods=" + methods.size() + "]";
    }

    // region Stage access

    /**
     * Claims the module for one stage operation. The returned handle releases it.
     */
    StageAccess enter(String operation) {
        Thread current = Thread.currentThread();
        if (!activeStage.compareAndSet(null, current)) {
            Thread holder = activeStage.get();
            throw new InvalidPipelineStateException(operation,
                    "module is in use by another stage on thread '" + (holder != null ? holder.getName() : "?") + "'");
        }
        return () -> activeStage.compareAndSet(current, null);
    }

    void requireState(ModuleState expected, String operation) {
        checkAccess(operation);
        if (state != expected) {
            throw new InvalidPipelineStateException(operation, "module is " + state + ", expected " + expected);
        }
    }

    void checkAccess(String operation) {
        if (activeStage.get() != Thread.currentThread()) {
            throw new InvalidPipelineStateException(operation,
                    "module is not held by a stage on thread '" + Thread.currentThread().getName() + "'");
        }
    }

    void addMethod(CompiledMethod method) {
        requireState(ModuleState.OPEN, "add method");
        methods.put(method.key(), method);
    }

    void recordMethodImports(String unitPath, Set<ImportDirective> imports) {
        checkAccess("record imports");
        methodImports.computeIfAbsent(unitPath, k -> new HashSet<>()).addAll(imports);
    }

    void markMethodsCompiled(boolean lowered) {
        requireState(ModuleState.OPEN, "compile methods");
        this.methodsCompiled = true;
        this.bodiesLowered = lowered;
    }

    void markCompilationBlocked() {
        markMethodsCompiled(false);
        this.compilationBlocked = true;
    }

    boolean addResource(ManifestResource resource) {
        requireState(ModuleState.OPEN, "add resource");
        return resources.putIfAbsent(resource.name(), resource) == null;
    }

    void setDocumentation(String text) {
        requireState(ModuleState.OPEN, "attach documentation");
        this.documentation = text;
    }

    void addDiagnostics(Collection<Diagnostic> reported) {
        checkAccess("report diagnostics");
        diagnostics.addAll(reported);
    }

    void seal() {
        requireState(ModuleState.OPEN, "finalize module");
        state = ModuleState.FINALIZED;
    }

    void markSerialized() {
        checkAccess("serialize module");
        if (state == ModuleState.FINALIZED) {
            state = ModuleState.SERIALIZED;
        }
    }

    @FunctionalInterface
    interface StageAccess extends AutoCloseable {
        @Override
        void close();
    }

    // endregion
}
