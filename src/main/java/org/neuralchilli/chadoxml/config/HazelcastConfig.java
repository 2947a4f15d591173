package org.neuralchilli.chadoxml.config;

import com.hazelcast.config.Config;
import com.hazelcast.config.InMemoryFormat;
import com.hazelcast.config.SerializationConfig;
import com.hazelcast.config.SerializerConfig;
import org.neuralchilli.chadoxml.cache.HandleResolver;
import org.neuralchilli.chadoxml.domain.Entity;
import org.neuralchilli.chadoxml.serializer.CodecStreamSerializer;
import org.neuralchilli.chadoxml.serializer.EntityCodec;
import org.neuralchilli.chadoxml.serializer.EntityCodecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the configuration of the embedded Hazelcast member that holds compressed entities.
 *
 * The member never joins a cluster: it exists for its binary map storage and for the
 * serializer plumbing that lets each entity type be encoded by its own codec.
 */
public final class HazelcastConfig {

    private static final Logger log = LoggerFactory.getLogger(HazelcastConfig.class);

    private HazelcastConfig() {
    }

    public static Config storeConfig(String clusterName, EntityCodecRegistry codecs, HandleResolver handles) {
        Config config = new Config();
        config.setClusterName(clusterName);
        config.setClassLoader(HazelcastConfig.class.getClassLoader());

        // Disable all network discovery for the embedded store
        config.getNetworkConfig().getJoin().getMulticastConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getTcpIpConfig().setEnabled(false);
        config.getNetworkConfig().getJoin().getAutoDetectionConfig().setEnabled(false);

        config.setProperty("hazelcast.logging.type", "slf4j");
        config.setProperty("hazelcast.phone.home.enabled", "false");
        config.setProperty("hazelcast.shutdownhook.enabled", "false");
        config.setProperty("hazelcast.partition.count", "7");
        config.getMetricsConfig().setEnabled(false);

        // One member, nothing to back up; payloads stay serialized at rest
        config.getMapConfig("*")
                .setBackupCount(0)
                .setAsyncBackupCount(0)
                .setInMemoryFormat(InMemoryFormat.BINARY);

        SerializationConfig serializationConfig = config.getSerializationConfig();
        serializationConfig.setEnableSharedObject(false);
        registerCodecs(serializationConfig, codecs, handles);

        return config;
    }

    /**
     * Install every registered codec as the Hazelcast serializer for its entity class.
     */
    private static void registerCodecs(SerializationConfig serializationConfig,
                                       EntityCodecRegistry codecs,
                                       HandleResolver handles) {
        for (EntityCodec<?> codec : codecs.codecs()) {
            serializationConfig.addSerializerConfig(serializerConfig(codec, handles));
            log.debug("Registered {} codec (TYPE_ID: {})", codec.typeTag(), codec.typeId());
        }
        log.debug("Entity codecs registered: {}", codecs.codecs().size());
    }

    private static <T extends Entity> SerializerConfig serializerConfig(EntityCodec<T> codec, HandleResolver handles) {
        return new SerializerConfig()
                .setTypeClass(codec.entityClass())
                .setImplementation(new CodecStreamSerializer<>(codec, handles));
    }
}
