package org.stagecraft.compiler.syntax;

/**
 * Declared accessibility of a type or member.
 */
public enum Visibility {
    PUBLIC,
    INTERNAL,
    PRIVATE
}
