package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

/**
 * A named property of the experiment, e.g. "Investigation Title".
 */
public record ExperimentProp(
        String id,
        String name,
        String value,
        Integer rank,
        CachedHandle<CVTerm> type,
        CachedHandle<DBXref> dbxref
) implements Entity {

    public ExperimentProp {
        Entities.requireId(id, "ExperimentProp");
    }

    public static ExperimentProp blank(String id) {
        return new ExperimentProp(id, null, null, null, null, null);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("value", value);
        sink.scalar("rank", rank);
        sink.reference("type_id", type);
        sink.reference("dbxref_id", dbxref);
    }
}
