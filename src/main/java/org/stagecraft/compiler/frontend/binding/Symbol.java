package org.stagecraft.compiler.frontend.binding;

import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.syntax.Visibility;

/**
 * Represents a single declared symbol (a type or a member) in the symbol table.
 *
 * @param name The simple name.
 * @param kind The kind of the symbol.
 * @param qualifiedName The fully qualified name, e.g. {@code app.Main.run}.
 * @param visibility The declared visibility.
 * @param source The declaration location, {@link SourceInfo#NONE} for referenced or builtin symbols.
 * @param origin The unit path or metadata reference name that declared the symbol.
 */
public record Symbol(String name, Kind kind, String qualifiedName, Visibility visibility, SourceInfo source, String origin) {

    /** Origin of the builtin types. */
    public static final String BUILTIN_ORIGIN = "<builtin>";

    /**
     * The kind of a symbol in the symbol table.
     */
    public enum Kind {
        /** A type declared in source, in a reference, or builtin. */
        TYPE,
        /** A field of a source type. */
        FIELD,
        /** A method of a source type. */
        METHOD
    }

    /**
     * @return {@code true} if the symbol is declared by a metadata reference or is builtin.
     */
    public boolean isExternal() {
        return source == SourceInfo.NONE;
    }
}
