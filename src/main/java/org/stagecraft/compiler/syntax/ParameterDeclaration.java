package org.stagecraft.compiler.syntax;

/**
 * A method parameter.
 *
 * @param name The parameter name.
 * @param typeName The (unresolved) parameter type name.
 */
public record ParameterDeclaration(String name, String typeName) {
}
