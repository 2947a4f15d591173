package org.neuralchilli.chadoxml.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.Entity;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Field helpers shared by the codecs. Nullable values are prefixed with a presence flag;
 * strings rely on Hazelcast's own null encoding.
 */
final class CodecSupport {

    private CodecSupport() {
    }

    static void writeHandle(ObjectDataOutput out, CachedHandle<? extends Entity> handle) throws IOException {
        out.writeString(handle == null ? null : handle.id());
    }

    static <T extends Entity> CachedHandle<T> readHandle(
            ObjectDataInput in, HandleResolver handles, Class<T> type) throws IOException {
        String id = in.readString();
        return id == null ? null : handles.getOrCreate(type, id);
    }

    static void writeHandles(ObjectDataOutput out, List<? extends CachedHandle<? extends Entity>> list) throws IOException {
        out.writeInt(list.size());
        for (CachedHandle<? extends Entity> handle : list) {
            out.writeString(handle.id());
        }
    }

    static <T extends Entity> List<CachedHandle<T>> readHandles(
            ObjectDataInput in, HandleResolver handles, Class<T> type) throws IOException {
        int size = in.readInt();
        List<CachedHandle<T>> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(handles.getOrCreate(type, in.readString()));
        }
        return result;
    }

    static void writeIntegerOrNull(ObjectDataOutput out, Integer value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeInt(value);
        }
    }

    static Integer readIntegerOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readInt() : null;
    }

    static void writeDoubleOrNull(ObjectDataOutput out, Double value) throws IOException {
        if (value == null) {
            out.writeBoolean(false);
        } else {
            out.writeBoolean(true);
            out.writeDouble(value);
        }
    }

    static Double readDoubleOrNull(ObjectDataInput in) throws IOException {
        boolean hasValue = in.readBoolean();
        return hasValue ? in.readDouble() : null;
    }
}
