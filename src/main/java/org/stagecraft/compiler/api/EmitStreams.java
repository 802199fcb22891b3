package org.stagecraft.compiler.api;

import java.io.OutputStream;
import java.util.Objects;

/**
 * The caller-owned byte sinks of an emit. The pipeline writes from each stream's current
 * position forward and never closes or rewinds a stream.
 *
 * @param primary The primary image sink (required).
 * @param metadata The metadata-only image sink, or {@code null}.
 * @param debug The separate debug information sink, or {@code null}.
 * @param documentation The documentation sink, or {@code null}.
 */
public record EmitStreams(OutputStream primary, OutputStream metadata, OutputStream debug, OutputStream documentation) {

    public EmitStreams {
        Objects.requireNonNull(primary, "primary stream is required");
    }

    /**
     * @param primary The primary image sink.
     * @return Streams with only a primary sink.
     */
    public static EmitStreams primaryOnly(OutputStream primary) {
        return new EmitStreams(primary, null, null, null);
    }

    public EmitStreams withMetadata(OutputStream stream) {
        return new EmitStreams(primary, stream, debug, documentation);
    }

    public EmitStreams withDebug(OutputStream stream) {
        return new EmitStreams(primary, metadata, stream, documentation);
    }

    public EmitStreams withDocumentation(OutputStream stream) {
        return new EmitStreams(primary, metadata, debug, stream);
    }
}
