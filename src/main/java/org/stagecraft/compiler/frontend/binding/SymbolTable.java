package org.stagecraft.compiler.frontend.binding;

import org.stagecraft.compiler.api.CompilerErrorCode;
import org.stagecraft.compiler.api.SourceInfo;
import org.stagecraft.compiler.diagnostics.DiagnosticBag;
import org.stagecraft.compiler.syntax.TypeDeclaration;
import org.stagecraft.compiler.syntax.Visibility;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The declaration table built by the declare pass of {@link DeclarationBinder}.
 * <p>
 * The table is written by exactly one thread and then {@link #freeze() frozen}. A frozen table
 * is read-only and may be queried concurrently by later stages and analyzers.
 */
public class SymbolTable {

    private static final Map<String, Symbol> BUILTINS;

    static {
        Map<String, Symbol> builtins = new HashMap<>();
        for (String name : new String[]{"void", "int", "bool", "string", "object"}) {
            builtins.put(name, new Symbol(name, Symbol.Kind.TYPE, name, Visibility.PUBLIC, SourceInfo.NONE, Symbol.BUILTIN_ORIGIN));
        }
        BUILTINS = Collections.unmodifiableMap(builtins);
    }

    private final Set<String> namespaces = new HashSet<>();
    private final Map<String, Map<String, Symbol>> typesByNamespace = new HashMap<>(); // namespace -> (name -> type)
    private final Map<String, Map<String, Symbol>> membersByType = new HashMap<>();    // qualified type -> (name -> member)
    private final Map<String, TypeDeclaration> declarations = new HashMap<>();
    private boolean frozen;

    /**
     * Builds a qualified name from a namespace and a simple name.
     * @param namespace The namespace, {@code ""} for the global namespace.
     * @param name The simple name.
     * @return The qualified name.
     */
    public static String qualify(String namespace, String name) {
        return namespace.isEmpty() ? name : namespace + "." + name;
    }

    /**
     * @param name A type name as written.
     * @return The builtin type with that name, if any.
     */
    public static Optional<Symbol> builtin(String name) {
        return Optional.ofNullable(BUILTINS.get(name));
    }

    /**
     * Declares a namespace so imports of it are valid.
     * @param namespace The namespace.
     */
    public void declareNamespace(String namespace) {
        checkWritable();
        namespaces.add(namespace);
    }

    /**
     * Defines a type symbol in its namespace.
     * Reports an error if the namespace already contains a type with the same name.
     *
     * @param namespace The namespace of the type.
     * @param symbol The type symbol.
     * @param declaration The source declaration, or {@code null} for referenced types.
     * @param diagnostics Where duplicates are reported; {@code null} silently keeps the first definition.
     * @return {@code true} if the symbol was added.
     */
    public boolean defineType(String namespace, Symbol symbol, TypeDeclaration declaration, DiagnosticBag diagnostics) {
        checkWritable();
        declareNamespace(namespace);
        Map<String, Symbol> types = typesByNamespace.computeIfAbsent(namespace, k -> new HashMap<>());
        if (types.containsKey(symbol.name()) || BUILTINS.containsKey(symbol.qualifiedName())) {
            if (diagnostics != null) {
                diagnostics.report(CompilerErrorCode.DUPLICATE_TYPE, symbol.source(),
                        namespace.isEmpty() ? "<global namespace>" : namespace, symbol.name());
            }
            return false;
        }
        types.put(symbol.name(), symbol);
        if (declaration != null) {
            declarations.put(symbol.qualifiedName(), declaration);
        }
        return true;
    }

    /**
     * Defines a member of a source type.
     * Reports an error if the type already has a member with the same name.
     *
     * @param typeQualifiedName The declaring type.
     * @param member The member symbol.
     * @param diagnostics Where duplicates are reported.
     * @return {@code true} if the member was added.
     */
    public boolean defineMember(String typeQualifiedName, Symbol member, DiagnosticBag diagnostics) {
        checkWritable();
        Map<String, Symbol> members = membersByType.computeIfAbsent(typeQualifiedName, k -> new HashMap<>());
        if (members.containsKey(member.name())) {
            diagnostics.report(CompilerErrorCode.DUPLICATE_MEMBER, member.source(), typeQualifiedName, member.name());
            return false;
        }
        members.put(member.name(), member);
        return true;
    }

    /**
     * Makes the table read-only.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean hasNamespace(String namespace) {
        return namespaces.contains(namespace);
    }

    /**
     * @param namespace The namespace to search.
     * @param name The simple type name.
     * @return The type, if declared in exactly that namespace.
     */
    public Optional<Symbol> lookupType(String namespace, String name) {
        Map<String, Symbol> types = typesByNamespace.get(namespace);
        return types == null ? Optional.empty() : Optional.ofNullable(types.get(name));
    }

    /**
     * @param qualifiedName A name such as {@code sys.io.Stream}.
     * @return The type, if declared.
     */
    public Optional<Symbol> lookupQualified(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        if (dot < 0) {
            return lookupType("", qualifiedName);
        }
        return lookupType(qualifiedName.substring(0, dot), qualifiedName.substring(dot + 1));
    }

    /**
     * @param typeQualifiedName The declaring type.
     * @param memberName The member name.
     * @return The member, if the source type declares it.
     */
    public Optional<Symbol> lookupMember(String typeQualifiedName, String memberName) {
        Map<String, Symbol> members = membersByType.get(typeQualifiedName);
        return members == null ? Optional.empty() : Optional.ofNullable(members.get(memberName));
    }

    /**
     * @param typeQualifiedName The type.
     * @return The source declaration, empty for referenced types.
     */
    public Optional<TypeDeclaration> declarationOf(String typeQualifiedName) {
        return Optional.ofNullable(declarations.get(typeQualifiedName));
    }

    /**
     * @return All declared types ordered by qualified name.
     */
    public Collection<Symbol> types() {
        Map<String, Symbol> sorted = new TreeMap<>();
        typesByNamespace.values().forEach(m -> m.values().forEach(s -> sorted.put(s.qualifiedName(), s)));
        return Collections.unmodifiableCollection(sorted.values());
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Symbol table is frozen");
        }
    }
}
