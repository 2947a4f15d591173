package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

import java.util.List;

public record Protocol(
        String id,
        String name,
        String description,
        Integer version,
        CachedHandle<DBXref> dbxref,
        List<CachedHandle<Attribute>> attributes
) implements Entity {

    public Protocol {
        Entities.requireId(id, "Protocol");
        attributes = Entities.copy(attributes);
    }

    public static Protocol blank(String id) {
        return new Protocol(id, null, null, null, null, List.of());
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("description", description);
        sink.scalar("version", version);
        sink.reference("dbxref_id", dbxref);
        sink.references("attribute_id", attributes);
    }
}
