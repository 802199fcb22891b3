package org.stagecraft.compiler.syntax;

import java.util.List;
import java.util.Objects;

/**
 * An already-parsed source unit. This is the opaque output of the parser that the pipeline
 * orchestrates; it carries no behavior.
 *
 * @param path The unique path of the unit.
 * @param namespace The namespace all types of the unit are declared in ({@code ""} for the global namespace).
 * @param imports The import directives in source order.
 * @param types The type declarations in source order.
 */
public record SourceUnit(
        String path,
        String namespace,
        List<ImportDirective> imports,
        List<TypeDeclaration> types
) {
    public SourceUnit {
        Objects.requireNonNull(path, "path");
        namespace = namespace != null ? namespace : "";
        imports = List.copyOf(imports);
        types = List.copyOf(types);
    }
}
