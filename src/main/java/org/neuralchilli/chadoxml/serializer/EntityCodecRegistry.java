package org.neuralchilli.chadoxml.serializer;

import org.neuralchilli.chadoxml.domain.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Dispatch table from type tag (and entity class) to codec.
 * <p>
 * Filled once at startup. Adding an entity type means registering its codec here;
 * the cache itself never names a concrete type.
 */
public final class EntityCodecRegistry {

    private static final Logger log = LoggerFactory.getLogger(EntityCodecRegistry.class);

    private final Map<String, EntityCodec<?>> byTag = new LinkedHashMap<>();
    private final Map<Class<?>, EntityCodec<?>> byClass = new HashMap<>();
    private final Set<Integer> typeIds = new HashSet<>();

    /**
     * Registry with a codec for every Chado entity type.
     */
    public static EntityCodecRegistry chado() {
        return new EntityCodecRegistry()
                .register(new ExperimentCodec())
                .register(new MetadataSerializers.ExperimentPropCodec())
                .register(new MetadataSerializers.ProtocolCodec())
                .register(new AppliedProtocolCodec())
                .register(new DatumCodec())
                .register(new MetadataSerializers.AttributeCodec())
                .register(new FeatureCodec())
                .register(new AnalysisFeatureCodec())
                .register(new MetadataSerializers.AnalysisCodec())
                .register(new MetadataSerializers.OrganismCodec())
                .register(new VocabularySerializers.CVTermCodec())
                .register(new VocabularySerializers.CVCodec())
                .register(new VocabularySerializers.DBXrefCodec())
                .register(new VocabularySerializers.DBCodec());
    }

    public <T extends Entity> EntityCodecRegistry register(EntityCodec<T> codec) {
        if (codec.typeTag() == null || codec.typeTag().isBlank()) {
            throw new IllegalArgumentException("Codec type tag cannot be null or empty");
        }
        if (codec.typeId() <= 0) {
            throw new IllegalArgumentException("Codec type id must be positive: " + codec.typeTag());
        }
        if (byTag.containsKey(codec.typeTag())) {
            throw new IllegalArgumentException("Duplicate codec for type tag: " + codec.typeTag());
        }
        if (byClass.containsKey(codec.entityClass())) {
            throw new IllegalArgumentException("Duplicate codec for " + codec.entityClass().getSimpleName());
        }
        if (!typeIds.add(codec.typeId())) {
            throw new IllegalArgumentException("Duplicate codec type id: " + codec.typeId());
        }

        byTag.put(codec.typeTag(), codec);
        byClass.put(codec.entityClass(), codec);
        log.trace("Registered codec {} (TYPE_ID: {})", codec.typeTag(), codec.typeId());
        return this;
    }

    public EntityCodec<?> forTag(String typeTag) {
        EntityCodec<?> codec = byTag.get(typeTag);
        if (codec == null) {
            throw new IllegalArgumentException("No codec registered for type: " + typeTag);
        }
        return codec;
    }

    @SuppressWarnings("unchecked")
    public <T extends Entity> EntityCodec<T> forClass(Class<T> type) {
        EntityCodec<?> codec = byClass.get(type);
        if (codec == null) {
            throw new IllegalArgumentException("No codec registered for " + type.getName());
        }
        return (EntityCodec<T>) codec;
    }

    public Collection<EntityCodec<?>> codecs() {
        return Collections.unmodifiableCollection(byTag.values());
    }
}
