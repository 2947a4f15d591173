package org.neuralchilli.chadoxml.domain;

import javax.annotation.Nonnull;

/**
 * Identifies one entity: its type tag plus its identifier within that type.
 */
public record EntityKey(String type, String id) {

    public EntityKey {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Entity type cannot be null or empty");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Entity id cannot be null or empty");
        }
    }

    /**
     * Key used in the backing store
     */
    public String asString() {
        return type + ":" + id;
    }

    @Nonnull
    @Override
    public String toString() {
        return asString();
    }
}
