package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.Entity;

import java.io.IOException;

/**
 * Compact binary form of one entity type.
 * <p>
 * {@link #write} must capture every field except the entity's own id, which is framed by
 * {@link CodecStreamSerializer}, writing referenced entities as identifiers only.
 * {@link #read} must rebuild those references through the {@link HandleResolver}, never by
 * materializing them, so that decoding one entity does not pull in its neighbours.
 */
public interface EntityCodec<T extends Entity> {

    /**
     * Type tag; also the ChadoXML element name for this type.
     */
    String typeTag();

    Class<T> entityClass();

    /**
     * Hazelcast serializer id, unique and positive.
     */
    int typeId();

    /**
     * The entity a placeholder materializes to.
     */
    T blank(String id);

    void write(ObjectDataOutput out, T entity) throws IOException;

    T read(ObjectDataInput in, String id, HandleResolver handles) throws IOException;
}
