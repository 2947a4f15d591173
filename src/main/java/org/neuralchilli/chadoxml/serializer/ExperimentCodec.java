package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.AppliedProtocol;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.domain.ExperimentProp;

import java.io.IOException;

import static org.neuralchilli.chadoxml.serializer.CodecSupport.readHandles;
import static org.neuralchilli.chadoxml.serializer.CodecSupport.writeHandles;

public class ExperimentCodec implements EntityCodec<Experiment> {

    private static final int TYPE_ID = 2001;

    @Override
    public String typeTag() {
        return "experiment";
    }

    @Override
    public Class<Experiment> entityClass() {
        return Experiment.class;
    }

    @Override
    public int typeId() {
        return TYPE_ID;
    }

    @Override
    public Experiment blank(String id) {
        return Experiment.blank(id);
    }

    @Override
    public void write(ObjectDataOutput out, Experiment experiment) throws IOException {
        out.writeString(experiment.uniquename());
        out.writeString(experiment.description());
        writeHandles(out, experiment.properties());
        writeHandles(out, experiment.appliedProtocols());
    }

    @Override
    public Experiment read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
        String uniquename = in.readString();
        String description = in.readString();

        return new Experiment(
                id,
                uniquename,
                description,
                readHandles(in, handles, ExperimentProp.class),
                readHandles(in, handles, AppliedProtocol.class)
        );
    }
}
