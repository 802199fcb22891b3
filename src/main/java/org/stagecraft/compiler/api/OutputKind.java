package org.stagecraft.compiler.api;

/**
 * The kind of module a compilation produces.
 */
public enum OutputKind {
    /** A library module without an entry point. */
    LIBRARY,
    /** An executable module. */
    CONSOLE_APPLICATION,
    /** A module that is linked into another module. */
    MODULE
}
