package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.AppliedProtocol;
import org.neuralchilli.chadoxml.domain.Datum;
import org.neuralchilli.chadoxml.domain.Protocol;

import java.io.IOException;

import static org.neuralchilli.chadoxml.serializer.CodecSupport.*;

public class AppliedProtocolCodec implements EntityCodec<AppliedProtocol> {

    private static final int TYPE_ID = 2004;

    @Override
    public String typeTag() {
        return "applied_protocol";
    }

    @Override
    public Class<AppliedProtocol> entityClass() {
        return AppliedProtocol.class;
    }

    @Override
    public int typeId() {
        return TYPE_ID;
    }

    @Override
    public AppliedProtocol blank(String id) {
        return AppliedProtocol.blank(id);
    }

    @Override
    public void write(ObjectDataOutput out, AppliedProtocol step) throws IOException {
        writeHandle(out, step.protocol());
        writeHandles(out, step.inputs());
        writeHandles(out, step.outputs());
    }

    @Override
    public AppliedProtocol read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
        CachedHandle<Protocol> protocol = readHandle(in, handles, Protocol.class);
        return new AppliedProtocol(
                id,
                protocol,
                readHandles(in, handles, Datum.class),
                readHandles(in, handles, Datum.class)
        );
    }
}
