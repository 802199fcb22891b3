package org.stagecraft.compiler.api;

/**
 * Identifies one of the caller-supplied output sinks of an emit.
 */
public enum OutputStreamKind {
    PRIMARY,
    METADATA,
    DEBUG,
    DOCUMENTATION
}
