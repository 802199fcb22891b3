package org.stagecraft.compiler.api;

import java.util.Objects;
import java.util.Set;

/**
 * An external metadata handle: a precompiled module whose exported types are visible to the sources.
 *
 * @param name The referenced module name.
 * @param exportedTypes Qualified names of the exported types (e.g. {@code "sys.io.Stream"}).
 */
public record MetadataReference(String name, Set<String> exportedTypes) {
    public MetadataReference {
        Objects.requireNonNull(name, "name");
        exportedTypes = Set.copyOf(exportedTypes);
    }
}
