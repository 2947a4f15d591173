package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

import java.util.List;

/**
 * Root of the experiment graph: the submission's properties and its applied-protocol steps.
 */
public record Experiment(
        String id,
        String uniquename,
        String description,
        List<CachedHandle<ExperimentProp>> properties,
        List<CachedHandle<AppliedProtocol>> appliedProtocols
) implements Entity {

    public Experiment {
        Entities.requireId(id, "Experiment");
        properties = Entities.copy(properties);
        appliedProtocols = Entities.copy(appliedProtocols);
    }

    public static Experiment blank(String id) {
        return new Experiment(id, null, null, List.of(), List.of());
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("uniquename", uniquename);
        sink.scalar("description", description);
        sink.references("experiment_prop_id", properties);
        sink.references("applied_protocol_id", appliedProtocols);
    }
}
