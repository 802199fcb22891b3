package org.stagecraft.compiler.syntax;

import org.stagecraft.compiler.api.SourceInfo;

/**
 * A field of a type.
 *
 * @param name The field name.
 * @param typeName The (unresolved) field type name.
 * @param visibility The declared visibility.
 * @param source The location of the declaration.
 */
public record FieldDeclaration(String name, String typeName, Visibility visibility, SourceInfo source) {
}
