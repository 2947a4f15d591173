package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

/**
 * An accession in an external database (a term source).
 */
public record DBXref(
        String id,
        String accession,
        String version,
        CachedHandle<DB> db
) implements Entity {

    public DBXref {
        Entities.requireId(id, "DBXref");
    }

    public static DBXref blank(String id) {
        return new DBXref(id, null, null, null);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("accession", accession);
        sink.scalar("version", version);
        sink.reference("db_id", db);
    }
}
