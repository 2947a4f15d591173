package org.neuralchilli.chadoxml.domain;

/**
 * An external database; term sources declared by a submission are DBs.
 */
public record DB(String id, String name, String url, String description) implements Entity {

    public DB {
        Entities.requireId(id, "DB");
    }

    public static DB blank(String id) {
        return new DB(id, null, null, null);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("url", url);
        sink.scalar("description", description);
    }
}
