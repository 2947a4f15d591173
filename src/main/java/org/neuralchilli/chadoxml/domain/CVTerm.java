package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

/**
 * A term from a controlled vocabulary.
 */
public record CVTerm(
        String id,
        String name,
        String definition,
        boolean obsolete,
        CachedHandle<CV> cv,
        CachedHandle<DBXref> dbxref
) implements Entity {

    public CVTerm {
        Entities.requireId(id, "CVTerm");
    }

    public static CVTerm blank(String id) {
        return new CVTerm(id, null, null, false, null, null);
    }

    public CVTerm withDbxref(CachedHandle<DBXref> dbxref) {
        return new CVTerm(id, name, definition, obsolete, cv, dbxref);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("definition", definition);
        sink.scalar("is_obsolete", obsolete ? 1 : 0);
        sink.reference("cv_id", cv);
        sink.reference("dbxref_id", dbxref);
    }
}
