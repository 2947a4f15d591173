package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.*;

import java.io.IOException;
import java.util.List;

import static org.neuralchilli.chadoxml.serializer.CodecSupport.*;

/**
 * Datum payloads carry only feature ids; a datum backed by a large data file may list
 * thousands of features without any of them being decoded alongside it.
 */
public class DatumCodec implements EntityCodec<Datum> {

    private static final int TYPE_ID = 2005;

    @Override
    public String typeTag() {
        return "data";
    }

    @Override
    public Class<Datum> entityClass() {
        return Datum.class;
    }

    @Override
    public int typeId() {
        return TYPE_ID;
    }

    @Override
    public Datum blank(String id) {
        return Datum.blank(id);
    }

    @Override
    public void write(ObjectDataOutput out, Datum datum) throws IOException {
        out.writeString(datum.name());
        out.writeString(datum.heading());
        out.writeString(datum.value());
        writeHandle(out, datum.type());
        writeHandle(out, datum.dbxref());
        writeHandles(out, datum.attributes());
        writeHandles(out, datum.features());
    }

    @Override
    public Datum read(ObjectDataInput in, String id, HandleResolver handles) throws IOException {
        String name = in.readString();
        String heading = in.readString();
        String value = in.readString();
        CachedHandle<CVTerm> type = readHandle(in, handles, CVTerm.class);
        CachedHandle<DBXref> dbxref = readHandle(in, handles, DBXref.class);
        List<CachedHandle<Attribute>> attributes = readHandles(in, handles, Attribute.class);
        List<CachedHandle<Feature>> features = readHandles(in, handles, Feature.class);

        return new Datum(id, name, heading, value, type, dbxref, attributes, features);
    }
}
