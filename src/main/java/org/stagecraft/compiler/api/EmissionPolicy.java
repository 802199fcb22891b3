package org.stagecraft.compiler.api;

/**
 * Decides whether method compilation and serialization proceed when declaration binding reported errors.
 */
public enum EmissionPolicy {
    /** Declaration errors block method compilation and nothing is written. */
    FAIL_CLOSED,
    /** Compilation and serialization proceed best-effort; all errors are still reported. */
    EMIT_ANYWAY
}
