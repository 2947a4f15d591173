package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.Entity;

import java.io.IOException;

/**
 * Installs an {@link EntityCodec} as a Hazelcast serializer, bound to the cache
 * whose handles it resolves.
 */
public final class CodecStreamSerializer<T extends Entity> implements StreamSerializer<T> {

    private final EntityCodec<T> codec;
    private final HandleResolver handles;

    public CodecStreamSerializer(EntityCodec<T> codec, HandleResolver handles) {
        this.codec = codec;
        this.handles = handles;
    }

    @Override
    public void write(ObjectDataOutput out, T entity) throws IOException {
        out.writeString(entity.id());
        codec.write(out, entity);
    }

    @Override
    public T read(ObjectDataInput in) throws IOException {
        String id = in.readString();
        if (id == null) {
            throw new IOException("Payload for " + codec.typeTag() + " has no id");
        }
        return codec.read(in, id, handles);
    }

    @Override
    public int getTypeId() {
        return codec.typeId();
    }

    @Override
    public void destroy() {
    }
}
