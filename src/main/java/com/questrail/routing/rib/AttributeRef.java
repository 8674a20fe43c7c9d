package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.model.PathAttributes;

/**
 * A shared handle on an interned {@link PathAttributes} set.
 *
 * <p>Handles are issued by an {@link AttributeArena}; two routes carrying
 * equal attributes hold the same handle, so identity comparison is enough.
 * The reference count is owned by the arena and only mutated on the RIB
 * thread.</p>
 */
public final class AttributeRef
{
    private final PathAttributes attributes;
    private int references;

    AttributeRef(PathAttributes attributes) {
        this.attributes = attributes;
    }

    public PathAttributes attributes() {
        return attributes;
    }

    public int references() {
        return references;
    }

    int retain() {
        return ++references;
    }

    int release() {
        if (references == 0) {
            throw new IllegalStateException("attribute set already released: " + attributes);
        }
        return --references;
    }

    @Override
    public String toString() {
        return "AttributeRef{refs=" + references + ", " + attributes + '}';
    }
}
