package org.neuralchilli.chadoxml.domain;

public record CV(String id, String name, String definition) implements Entity {

    public CV {
        Entities.requireId(id, "CV");
    }

    public static CV blank(String id) {
        return new CV(id, null, null);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("definition", definition);
    }
}
