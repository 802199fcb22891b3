package org.stagecraft.compiler.api;

import com.typesafe.config.Config;

import java.util.Locale;
import java.util.Objects;

/**
 * Immutable compilation configuration of a {@link SourceSet}.
 * <p>
 * Options are never shared mutable state: changing them means creating a new record and,
 * through {@link SourceSet#withOptions(CompilationOptions)}, a new source set whose derived
 * state starts out unbound.
 *
 * @param concurrentBuild Whether stages may run work items in parallel.
 * @param outputKind The kind of module to produce.
 */
public record CompilationOptions(boolean concurrentBuild, OutputKind outputKind) {

    public CompilationOptions {
        Objects.requireNonNull(outputKind, "outputKind");
    }

    /**
     * @return Concurrent build of a library.
     */
    public static CompilationOptions defaults() {
        return new CompilationOptions(true, OutputKind.LIBRARY);
    }

    /**
     * Reads options from a {@code stagecraft.compilation} config block.
     * <pre>
     * compilation {
     *   concurrent-build = true
     *   output-kind = "LIBRARY"
     * }
     * </pre>
     *
     * @param config The config block.
     * @return The options; missing keys fall back to {@link #defaults()}.
     */
    public static CompilationOptions fromConfig(Config config) {
        CompilationOptions defaults = defaults();
        boolean concurrent = config.hasPath("concurrent-build")
                ? config.getBoolean("concurrent-build")
                : defaults.concurrentBuild();
        OutputKind kind = config.hasPath("output-kind")
                ? OutputKind.valueOf(config.getString("output-kind").toUpperCase(Locale.ROOT))
                : defaults.outputKind();
        return new CompilationOptions(concurrent, kind);
    }

    public CompilationOptions withConcurrentBuild(boolean value) {
        return new CompilationOptions(value, outputKind);
    }

    public CompilationOptions withOutputKind(OutputKind value) {
        return new CompilationOptions(concurrentBuild, value);
    }
}
