package org.stagecraft.compiler.frontend.binding;

import org.stagecraft.compiler.syntax.ImportDirective;

import java.util.List;

/**
 * The result of resolving a type name in the context of a source unit.
 *
 * @param symbol The resolved type, or {@code null}.
 * @param viaImport The import that made the type visible, or {@code null} if none was needed.
 * @param candidates Qualified names of all matches when the name is ambiguous, otherwise empty.
 */
public record TypeResolution(Symbol symbol, ImportDirective viaImport, List<String> candidates) {

    public TypeResolution {
        candidates = List.copyOf(candidates);
    }

    static TypeResolution resolved(Symbol symbol, ImportDirective viaImport) {
        return new TypeResolution(symbol, viaImport, List.of());
    }

    static TypeResolution notFound() {
        return new TypeResolution(null, null, List.of());
    }

    static TypeResolution ambiguous(List<String> candidates) {
        return new TypeResolution(null, null, candidates);
    }

    public boolean isResolved() {
        return symbol != null;
    }

    public boolean isAmbiguous() {
        return !candidates.isEmpty();
    }
}
