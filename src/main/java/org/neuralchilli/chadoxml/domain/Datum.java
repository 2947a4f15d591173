package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

import java.util.List;

/**
 * A data item consumed or produced by an applied protocol.
 * The value is often a path to a data file; features parsed from that file hang off the datum.
 */
public record Datum(
        String id,
        String name,
        String heading,
        String value,
        CachedHandle<CVTerm> type,
        CachedHandle<DBXref> dbxref,
        List<CachedHandle<Attribute>> attributes,
        List<CachedHandle<Feature>> features
) implements Entity {

    public Datum {
        Entities.requireId(id, "Datum");
        attributes = Entities.copy(attributes);
        features = Entities.copy(features);
    }

    public static Datum blank(String id) {
        return new Datum(id, null, null, null, null, null, List.of(), List.of());
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("heading", heading);
        sink.scalar("value", value);
        sink.reference("type_id", type);
        sink.reference("dbxref_id", dbxref);
        sink.references("attribute_id", attributes);
        sink.references("feature_id", features);
    }
}
