package org.stagecraft.compiler.diagnostics;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.SourceInfo;

import java.util.Objects;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced by binding, analyzers, method compilation or emission.
 *
 * @param severity The severity of the diagnostic.
 * @param id The message id, e.g. {@code SC0104} or an analyzer-defined id.
 * @param message The diagnostic message.
 * @param location Where the issue occurred; {@link SourceInfo#NONE} if not tied to a source.
 */
public record Diagnostic(
        Severity severity,
        String id,
        String message,
        SourceInfo location
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Severity {
        /** An error that makes the compilation unsuccessful. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(message, "message");
        location = location != null ? location : SourceInfo.NONE;
    }

    /**
     * Creates a diagnostic for a compiler error code using its default severity.
     * @param code The error code.
     * @param location The source location.
     * @param args The message arguments.
     * @return The new diagnostic.
     */
    public static Diagnostic of(CompilerErrorCode code, SourceInfo location, Object... args) {
        return new Diagnostic(code.defaultSeverity(), code.id(), code.format(args), location);
    }

    /**
     * @return {@code true} if this diagnostic is an error.
     */
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Returns a copy of this diagnostic with another severity.
     * @param newSeverity The severity to use.
     * @return The copy.
     */
    public Diagnostic withSeverity(Severity newSeverity) {
        return new Diagnostic(newSeverity, id, message, location);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s %s: %s", severity, id, location, message);
    }
}
