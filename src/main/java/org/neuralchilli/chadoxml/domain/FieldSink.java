package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

import java.util.List;
import java.util.function.Consumer;

/**
 * Receives the fields of an entity in schema order.
 * Null scalars and null references are skipped by implementations.
 */
public interface FieldSink {

    void scalar(String name, Object value);

    void reference(String name, CachedHandle<? extends Entity> handle);

    default void references(String name, List<? extends CachedHandle<? extends Entity>> handles) {
        for (CachedHandle<? extends Entity> handle : handles) {
            reference(name, handle);
        }
    }

    /**
     * An embedded value (featureloc, feature_relationship) that has no identity of its own.
     */
    void group(String name, Consumer<FieldSink> body);
}
