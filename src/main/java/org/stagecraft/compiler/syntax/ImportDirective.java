package org.stagecraft.compiler.syntax;

import org.stagecraft.compiler.api.SourceInfo;

/**
 * An import of all types of a namespace into a source unit.
 *
 * @param namespace The imported namespace.
 * @param source The location of the directive.
 */
public record ImportDirective(String namespace, SourceInfo source) {
}
