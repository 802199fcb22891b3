package org.stagecraft.compiler.backend.emit;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.DebugInfoMode;
import org.stagecraft.compiler.api.EmitStreams;
import org.stagecraft.compiler.api.InvalidPipelineStateException;
import org.stagecraft.compiler.api.OutputStreamKind;
import org.stagecraft.compiler.api.SerializationResult;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.diagnostics.DiagnosticBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Writes a finalized module to the caller's streams.
 * <p>
 * Every call is a complete, independent write from each stream's current position, so
 * serializing the same module again produces identical bytes. Streams are flushed, never
 * closed or rewound. I/O failures are reported as diagnostics.
 */
public class Serializer {

    private static final Logger LOG = LoggerFactory.getLogger(Serializer.class);

    /**
     * Serializes the module.
     *
     * @param module A finalized (or already serialized) module.
     * @param streams The output sinks.
     * @return The result of this write.
     * @throws InvalidPipelineStateException if the module is still open or in use by another stage.
     */
    public SerializationResult serialize(ModuleBuildState module, EmitStreams streams) {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(streams, "streams");
        String operation = "serialize module";
        try (ModuleBuildState.StageAccess access = module.enter(operation)) {
            return serializeHeld(module, streams, operation);
        }
    }

    private SerializationResult serializeHeld(ModuleBuildState module, EmitStreams streams, String operation) {
        if (module.state() == ModuleState.OPEN) {
            throw new InvalidPipelineStateException(operation, "module '" + module.moduleName() + "' is OPEN; it must be finalized first");
        }

        long start = System.nanoTime();
        DiagnosticBag diagnostics = new DiagnosticBag();
        Set<OutputStreamKind> written = EnumSet.noneOf(OutputStreamKind.class);
        ModuleImageWriter writer = new ModuleImageWriter(module);
        boolean metadataOnly = module.options().emitMetadataOnly();
        boolean separateDebug = !metadataOnly && module.options().debugInfoMode() == DebugInfoMode.SEPARATE;

        byte[] debugSection = null;
        Integer debugId = null;
        if (separateDebug) {
            try {
                debugSection = writer.debugSection();
                debugId = ModuleImageWriter.debugId(debugSection);
            } catch (IOException e) {
                fail(diagnostics, OutputStreamKind.DEBUG, e);
            }
        }

        Integer primaryDebugId = debugId;
        write(OutputStreamKind.PRIMARY, streams.primary(), out -> writer.writeImage(out, metadataOnly, primaryDebugId), diagnostics, written);

        if (streams.metadata() != null) {
            write(OutputStreamKind.METADATA, streams.metadata(), out -> writer.writeImage(out, true, null), diagnostics, written);
        }

        if (separateDebug && debugSection != null) {
            if (streams.debug() == null) {
                diagnostics.report(CompilerErrorCode.DEBUG_STREAM_MISSING, SourceInfo.NONE);
            } else {
                byte[] section = debugSection;
                write(OutputStreamKind.DEBUG, streams.debug(), out -> {
                    out.write(section);
                    out.flush();
                }, diagnostics, written);
            }
        }

        Optional<String> documentation = module.documentation();
        if (streams.documentation() != null && documentation.isPresent()) {
            byte[] text = documentation.get().getBytes(StandardCharsets.UTF_8);
            write(OutputStreamKind.DOCUMENTATION, streams.documentation(), out -> {
                out.write(text);
                out.flush();
            }, diagnostics, written);
        }

        boolean success = !diagnostics.hasErrors();
        if (success) {
            module.markSerialized();
        }
        LOG.debug("Serialized module '{}' to {} (success={}) in {} ms",
                module.moduleName(), written, success, (System.nanoTime() - start) / 1_000_000);
        return new SerializationResult(success, diagnostics.toSet(), written);
    }

    private static void write(OutputStreamKind kind, OutputStream target, StreamWrite action,
                              DiagnosticBag diagnostics, Set<OutputStreamKind> written) {
        try {
            action.writeTo(target);
            written.add(kind);
        } catch (IOException e) {
            fail(diagnostics, kind, e);
        }
    }

    private static void fail(DiagnosticBag diagnostics, OutputStreamKind kind, IOException e) {
        LOG.error("Writing the {} output failed", kind, e);
        diagnostics.report(CompilerErrorCode.OUTPUT_WRITE_FAILED, SourceInfo.NONE,
                kind.name().toLowerCase(Locale.ROOT), String.valueOf(e.getMessage()));
    }

    @FunctionalInterface
    private interface StreamWrite {
        void writeTo(OutputStream out) throws IOException;
    }
}
