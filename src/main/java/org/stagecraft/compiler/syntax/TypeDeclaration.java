package org.stagecraft.compiler.syntax;

import org.stagecraft.compiler.api.SourceInfo;

import java.util.List;

/**
 * A type declared in a source unit.
 *
 * @param name The simple type name.
 * @param visibility The declared visibility.
 * @param baseType The (unresolved) base type name, or {@code null}.
 * @param fields The fields in declaration order.
 * @param methods The methods in declaration order.
 * @param documentation The documentation comment text, or {@code null}.
 * @param source The location of the declaration.
 */
public record TypeDeclaration(
        String name,
        Visibility visibility,
        String baseType,
        List<FieldDeclaration> fields,
        List<MethodDeclaration> methods,
        String documentation,
        SourceInfo source
) {
    public TypeDeclaration {
        fields = List.copyOf(fields);
        methods = List.copyOf(methods);
    }
}
