package org.stagecraft.compiler.syntax;

import org.stagecraft.compiler.api.SourceInfo;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A method of a type.
 *
 * @param name The method name.
 * @param returnType The (unresolved) return type name.
 * @param parameters The parameters in declaration order.
 * @param visibility The declared visibility.
 * @param body The body instructions, or {@code null} for a method without body.
 * @param documentation The documentation comment text, or {@code null}.
 * @param source The location of the declaration.
 */
public record MethodDeclaration(
        String name,
        String returnType,
        List<ParameterDeclaration> parameters,
        Visibility visibility,
        List<BodyInstruction> body,
        String documentation,
        SourceInfo source
) {
    public MethodDeclaration {
        parameters = List.copyOf(parameters);
        body = body != null ? List.copyOf(body) : null;
    }

    /**
     * @return {@code true} if the method has a body to compile.
     */
    public boolean hasBody() {
        return body != null;
    }

    /**
     * @return The parameter type list as written, e.g. {@code (int,string)}.
     */
    public String signature() {
        return parameters.stream()
                .map(ParameterDeclaration::typeName)
                .collect(Collectors.joining(",", "(", ")"));
    }
}
