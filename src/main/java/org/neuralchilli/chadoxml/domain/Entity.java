package org.neuralchilli.chadoxml.domain;

/**
 * A node of the experiment graph.
 * <p>
 * Entities are immutable. They refer to other entities only through
 * {@link org.neuralchilli.chadoxml.cache.CachedHandle}s obtained from the same cache,
 * so replacing an entity means putting a new version under the same key.
 */
public interface Entity {

    /**
     * Identifier, unique within the entity's type.
     */
    String id();

    /**
     * Report every field to the sink in schema order.
     * The order is fixed per type so that output does not depend on creation order.
     */
    void describe(FieldSink sink);
}
