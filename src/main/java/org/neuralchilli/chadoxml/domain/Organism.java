package org.neuralchilli.chadoxml.domain;

public record Organism(String id, String genus, String species) implements Entity {

    public Organism {
        Entities.requireId(id, "Organism");
    }

    public static Organism blank(String id) {
        return new Organism(id, null, null);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("genus", genus);
        sink.scalar("species", species);
    }
}
