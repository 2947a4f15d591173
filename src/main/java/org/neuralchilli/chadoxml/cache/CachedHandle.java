package org.neuralchilli.chadoxml.cache;

import org.neuralchilli.chadoxml.domain.Entity;
import org.neuralchilli.chadoxml.domain.EntityKey;

import javax.annotation.Nonnull;

/**
 * The single stand-in for an entity wherever it is referenced.
 * <p>
 * An {@link ObjectCache} creates exactly one handle per {@link EntityKey}, so handles compare
 * by identity: two references to the same handle are two references to the same entity.
 * Dereference through {@link ObjectCache#materialize(CachedHandle)}.
 */
public final class CachedHandle<T extends Entity> {

    private final EntityKey key;
    private final Class<T> entityClass;
    private HandleState state;
    private boolean registered;

    CachedHandle(EntityKey key, Class<T> entityClass, HandleState state) {
        this.key = key;
        this.entityClass = entityClass;
        this.state = state;
    }

    public EntityKey key() {
        return key;
    }

    public String type() {
        return key.type();
    }

    public String id() {
        return key.id();
    }

    public Class<T> entityClass() {
        return entityClass;
    }

    public synchronized boolean isMaterialized() {
        return state instanceof HandleState.Materialized;
    }

    /**
     * True until something has been put under this handle's key,
     * even if the blank entity has been materialized in the meantime.
     */
    public synchronized boolean isPlaceholder() {
        return !registered;
    }

    synchronized HandleState state() {
        return state;
    }

    synchronized void transition(HandleState next) {
        this.state = next;
    }

    synchronized void markRegistered() {
        this.registered = true;
    }

    @Nonnull
    @Override
    public String toString() {
        HandleState current = state();
        String label;
        if (isPlaceholder()) {
            label = "placeholder";
        } else if (current instanceof HandleState.Materialized) {
            label = "materialized";
        } else {
            label = "compressed";
        }
        return String.format("CachedHandle[%s, %s]", key, label);
    }
}
