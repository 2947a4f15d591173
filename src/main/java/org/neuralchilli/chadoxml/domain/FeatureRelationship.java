package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

/**
 * Typed edge from the owning (subject) feature to an object feature, e.g. part_of.
 */
public record FeatureRelationship(
        CachedHandle<CVTerm> type,
        CachedHandle<Feature> object,
        int rank
) {

    public FeatureRelationship {
        if (object == null) {
            throw new IllegalArgumentException("Feature relationship must have an object feature");
        }
    }

    void describe(FieldSink sink) {
        sink.reference("type_id", type);
        sink.reference("object_id", object);
        sink.scalar("rank", rank);
    }
}
