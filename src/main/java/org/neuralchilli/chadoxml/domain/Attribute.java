package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

public record Attribute(
        String id,
        String name,
        String heading,
        String value,
        Integer rank,
        CachedHandle<CVTerm> type,
        CachedHandle<DBXref> dbxref
) implements Entity {

    public Attribute {
        Entities.requireId(id, "Attribute");
    }

    public static Attribute blank(String id) {
        return new Attribute(id, null, null, null, null, null, null);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("heading", heading);
        sink.scalar("value", value);
        sink.scalar("rank", rank);
        sink.reference("type_id", type);
        sink.reference("dbxref_id", dbxref);
    }
}
