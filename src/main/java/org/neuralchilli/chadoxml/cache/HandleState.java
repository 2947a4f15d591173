package org.neuralchilli.chadoxml.cache;

import org.neuralchilli.chadoxml.domain.Entity;

/**
 * State of a {@link CachedHandle}: either the entity is in memory, or it is not
 * and its payload (if any) lives in the cache's backing store.
 */
public sealed interface HandleState permits HandleState.Compressed, HandleState.Materialized {

    /**
     * Not in memory. {@code stored} is false for a placeholder that has never been put,
     * which materializes to the type's blank entity.
     */
    record Compressed(boolean stored) implements HandleState {
        static final Compressed EMPTY = new Compressed(false);
        static final Compressed STORED = new Compressed(true);
    }

    record Materialized(Entity entity) implements HandleState {
        public Materialized {
            if (entity == null) {
                throw new IllegalArgumentException("Materialized entity cannot be null");
            }
        }
    }
}
