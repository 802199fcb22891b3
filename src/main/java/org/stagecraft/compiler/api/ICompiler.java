package org.stagecraft.compiler.api;

import org.stagecraft.compiler.diagnostics.DiagnosticSet;

import java.util.List;

/**
 * Defines the public interface of the compilation pipeline.
 */
public interface ICompiler {

    /**
     * Returns the declaration diagnostics of a source set, binding it first if necessary.
     *
     * @param sourceSet The source set.
     * @return The diagnostics.
     */
    DiagnosticSet getDiagnostics(SourceSet sourceSet);

    /**
     * Runs method compilation, finalization and serialization for a source set.
     *
     * @param sourceSet The source set to emit.
     * @param streams The output sinks.
     * @param options The emit options.
     * @param resources The manifest resources to embed.
     * @return The merged result of all stages.
     * @throws IllegalArgumentException if the streams do not fit the options.
     */
    SerializationResult emit(SourceSet sourceSet, EmitStreams streams, EmitOptions options, List<ManifestResource> resources);

    /**
     * Emits without manifest resources.
     *
     * @param sourceSet The source set to emit.
     * @param streams The output sinks.
     * @param options The emit options.
     * @return The merged result of all stages.
     */
    default SerializationResult emit(SourceSet sourceSet, EmitStreams streams, EmitOptions options) {
        return emit(sourceSet, streams, options, List.of());
    }
}
