package com.questrail.routing.rib;

import com.questrail.routing.protocol.bgp.model.PathAttributes;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * AttributeArena
 * =============================================================================
 * Interning store for path attribute sets.
 *
 * <p>Many prefixes typically share one attribute set. Each RIB entry that
 * stores an attribute set holds one reference on it; the set is dropped from
 * the arena when its last reference is released.</p>
 *
 * <p>Not thread-safe. The arena belongs to the {@link RibEngine} and is
 * touched only on the coordinator thread.</p>
 */
public final class AttributeArena
{
    private final Map<PathAttributes, AttributeRef> interned = new HashMap<>();

    /**
     * Returns the shared handle for {@code attributes}, taking one reference on it.
     */
    public AttributeRef acquire(PathAttributes attributes) {
        Objects.requireNonNull(attributes, "attributes");
        AttributeRef ref = interned.computeIfAbsent(attributes, AttributeRef::new);
        ref.retain();
        return ref;
    }

    /**
     * Takes one more reference on an existing handle.
     */
    public AttributeRef retain(AttributeRef ref) {
        Objects.requireNonNull(ref, "ref");
        if (interned.get(ref.attributes()) != ref) {
            throw new IllegalArgumentException("handle does not belong to this arena");
        }
        ref.retain();
        return ref;
    }

    /**
     * Drops one reference; the set leaves the arena when none remain.
     */
    public void release(AttributeRef ref) {
        Objects.requireNonNull(ref, "ref");
        if (ref.release() == 0) {
            interned.remove(ref.attributes());
        }
    }

    /** Number of distinct attribute sets currently referenced. */
    public int size() {
        return interned.size();
    }
}
