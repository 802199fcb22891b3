package org.stagecraft.compiler.api;

/**
 * Controls where debug information is written during serialization.
 */
public enum DebugInfoMode {
    /** No debug information is produced. */
    NONE,
    /** Debug information is embedded into the primary image. */
    EMBEDDED,
    /** Debug information is written to a separate debug stream. */
    SEPARATE
}
