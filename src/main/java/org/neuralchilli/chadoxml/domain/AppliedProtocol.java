package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

import java.util.List;

/**
 * One step of the experiment: a protocol applied to input data, producing output data.
 * The same datum may be the output of one step and the input of the next.
 */
public record AppliedProtocol(
        String id,
        CachedHandle<Protocol> protocol,
        List<CachedHandle<Datum>> inputs,
        List<CachedHandle<Datum>> outputs
) implements Entity {

    public AppliedProtocol {
        Entities.requireId(id, "AppliedProtocol");
        inputs = Entities.copy(inputs);
        outputs = Entities.copy(outputs);
    }

    public static AppliedProtocol blank(String id) {
        return new AppliedProtocol(id, null, List.of(), List.of());
    }

    @Override
    public void describe(FieldSink sink) {
        sink.reference("protocol_id", protocol);
        sink.references("input_data_id", inputs);
        sink.references("output_data_id", outputs);
    }
}
