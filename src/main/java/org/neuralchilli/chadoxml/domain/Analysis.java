package org.neuralchilli.chadoxml.domain;

public record Analysis(
        String id,
        String name,
        String program,
        String programversion,
        String sourcename,
        String description
) implements Entity {

    public Analysis {
        Entities.requireId(id, "Analysis");
    }

    public static Analysis blank(String id) {
        return new Analysis(id, null, null, null, null, null);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("program", program);
        sink.scalar("programversion", programversion);
        sink.scalar("sourcename", sourcename);
        sink.scalar("description", description);
    }
}
