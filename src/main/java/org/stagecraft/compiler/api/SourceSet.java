package org.stagecraft.compiler.api;

import org.stagecraft.compiler.frontend.binding.BoundDeclarationState;
import org.stagecraft.compiler.frontend.binding.DeclarationBinder;
import org.stagecraft.compiler.syntax.SourceUnit;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable collection of parsed source units, metadata references and compilation options.
 * <p>
 * The source set owns its {@link BoundDeclarationState}. Binding happens lazily on the first
 * request and at most once per instance; afterwards the cached state is returned to every
 * caller on every thread. To recompile from scratch (for example with other options) create a
 * new instance with {@link #withOptions(CompilationOptions)}: the new instance starts unbound.
 */
public final class SourceSet {

    private final String assemblyName;
    private final List<SourceUnit> units;
    private final Set<MetadataReference> references;
    private final CompilationOptions options;
    private final DeclarationBinder binder;

    private final Object bindLock = new Object();
    private volatile BoundDeclarationState boundState;

    private SourceSet(String assemblyName, List<SourceUnit> units, Set<MetadataReference> references,
                      CompilationOptions options, DeclarationBinder binder) {
        if (assemblyName == null || assemblyName.isBlank()) {
            throw new IllegalArgumentException("Assembly name must not be blank");
        }
        Set<String> paths = new HashSet<>();
        for (SourceUnit unit : units) {
            Objects.requireNonNull(unit, "source unit");
            if (!paths.add(unit.path())) {
                throw new IllegalArgumentException("Duplicate source unit path: " + unit.path());
            }
        }
        this.assemblyName = assemblyName;
        this.units = List.copyOf(units);
        this.references = Set.copyOf(references);
        this.options = Objects.requireNonNull(options, "options");
        this.binder = Objects.requireNonNull(binder, "binder");
    }

    /**
     * Creates a source set with the default binder.
     *
     * @param assemblyName The name of the module to build.
     * @param units The parsed units, in order.
     * @param references The metadata references.
     * @param options The compilation options.
     * @return The new source set.
     * @throws IllegalArgumentException if the name is blank or two units share a path.
     */
    public static SourceSet create(String assemblyName, List<SourceUnit> units,
                                   Set<MetadataReference> references, CompilationOptions options) {
        return new SourceSet(assemblyName, units, references, options, new DeclarationBinder());
    }

    /**
     * @param assemblyName The name of the module to build.
     * @return A builder for a new source set.
     */
    public static Builder builder(String assemblyName) {
        return new Builder(assemblyName);
    }

    /**
     * Returns a new source set with the same content and other options. The derived state of
     * this instance is not carried over.
     *
     * @param newOptions The options of the new source set.
     * @return A new, unbound source set.
     */
    public SourceSet withOptions(CompilationOptions newOptions) {
        return new SourceSet(assemblyName, units, references, newOptions, binder);
    }

    /**
     * @param concurrentBuild The concurrency flag of the new source set.
     * @return A new, unbound source set.
     */
    public SourceSet withConcurrentBuild(boolean concurrentBuild) {
        return withOptions(options.withConcurrentBuild(concurrentBuild));
    }

    /**
     * Returns the bound declarations, binding them first if this has not happened yet.
     * Concurrent callers wait for a single binding run.
     *
     * @return The memoized bound state.
     */
    public BoundDeclarationState boundState() {
        BoundDeclarationState result = boundState;
        if (result == null) {
            synchronized (bindLock) {
                result = boundState;
                if (result == null) {
                    result = binder.bind(this);
                    boundState = result;
                }
            }
        }
        return result;
    }

    /**
     * @return {@code true} once declaration binding has completed for this instance.
     */
    public boolean isBound() {
        return boundState != null;
    }

    public String assemblyName() {
        return assemblyName;
    }

    public List<SourceUnit> units() {
        return units;
    }

    public Set<MetadataReference> references() {
        return references;
    }

    public CompilationOptions options() {
        return options;
    }

    @Override
    public String toString() {
        return "SourceSet[" + assemblyName + ", units=" + units.size() + ", references=" + references.size() + ", " + options + "]";
    }

    /**
     * Collects the parts of a {@link SourceSet}.
     */
    public static final class Builder {
        private final String assemblyName;
        private final List<SourceUnit> units = new ArrayList<>();
        private final Set<MetadataReference> references = new LinkedHashSet<>();
        private CompilationOptions options = CompilationOptions.defaults();
        private DeclarationBinder binder;

        private Builder(String assemblyName) {
            this.assemblyName = assemblyName;
        }

        public Builder addUnit(SourceUnit unit) {
            units.add(unit);
            return this;
        }

        public Builder addUnits(List<SourceUnit> more) {
            units.addAll(more);
            return this;
        }

        public Builder addReference(MetadataReference reference) {
            references.add(reference);
            return this;
        }

        public Builder options(CompilationOptions value) {
            this.options = value;
            return this;
        }

        /**
         * Overrides the binder, e.g. to bind on a dedicated pool.
         * @param value The binder.
         * @return This builder.
         */
        public Builder binder(DeclarationBinder value) {
            this.binder = value;
            return this;
        }

        public SourceSet build() {
            return new SourceSet(assemblyName, units, references, options,
                    binder != null ? binder : new DeclarationBinder());
        }
    }
}
