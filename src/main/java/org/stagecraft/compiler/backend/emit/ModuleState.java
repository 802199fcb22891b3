package org.stagecraft.compiler.backend.emit;

/**
 * The lifecycle of a {@link ModuleBuildState}. Transitions only move forward.
 */
public enum ModuleState {
    /** Methods and resources may still be added. */
    OPEN,
    /** Sealed by the finalizer; ready to serialize. */
    FINALIZED,
    /** Written at least once. May be serialized again. */
    SERIALIZED
}
