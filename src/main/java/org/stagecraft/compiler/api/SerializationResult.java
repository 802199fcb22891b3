package org.stagecraft.compiler.api;

import org.stagecraft.compiler.diagnostics.DiagnosticSet;

import java.util.EnumSet;
import java.util.Set;

/**
 * The outcome of serializing a module or of a complete emit.
 *
 * @param success Whether the output is complete and no error was reported.
 * @param diagnostics All diagnostics of the run, in stage order.
 * @param streamsWritten The sinks that received data.
 */
public record SerializationResult(boolean success, DiagnosticSet diagnostics, Set<OutputStreamKind> streamsWritten) {

    public SerializationResult {
        streamsWritten = streamsWritten.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(streamsWritten));
    }

    /**
     * @param diagnostics The diagnostics explaining the failure.
     * @return A failed result for which no stream was written.
     */
    public static SerializationResult failed(DiagnosticSet diagnostics) {
        return new SerializationResult(false, diagnostics, Set.of());
    }

    /**
     * @param kind The sink kind.
     * @return {@code true} if the sink received data.
     */
    public boolean wrote(OutputStreamKind kind) {
        return streamsWritten.contains(kind);
    }
}
