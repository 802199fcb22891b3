package org.stagecraft.compiler.api;

import java.util.Objects;

/**
 * A resource embedded into the module manifest during finalization.
 *
 * @param name The manifest name of the resource.
 * @param data The resource content. The array is copied on construction.
 * @param isPublic Whether the resource is visible to other modules.
 */
public record ManifestResource(String name, byte[] data, boolean isPublic) {
    public ManifestResource {
        Objects.requireNonNull(name, "name");
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }
}
