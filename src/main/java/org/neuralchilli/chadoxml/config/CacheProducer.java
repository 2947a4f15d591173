package org.neuralchilli.chadoxml.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.chadoxml.cache.CacheSettings;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.core.ChadoXmlWriter;
import org.neuralchilli.chadoxml.core.GraphInspector;
import org.neuralchilli.chadoxml.monitoring.PerformanceMonitor;
import org.neuralchilli.chadoxml.serializer.EntityCodecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the object cache and the components that read it.
 * The cache is handed out uninitialized; the command owns its init/destroy window.
 */
@ApplicationScoped
public class CacheProducer {

    private static final Logger log = LoggerFactory.getLogger(CacheProducer.class);

    @ConfigProperty(name = "chadoxml.cache.cluster-name", defaultValue = "chadoxml")
    String clusterName;

    @ConfigProperty(name = "chadoxml.cache.max-materialized", defaultValue = "0")
    int maxMaterialized;

    @Inject
    PerformanceMonitor monitor;

    @Produces
    @Singleton
    public EntityCodecRegistry entityCodecRegistry() {
        return EntityCodecRegistry.chado();
    }

    @Produces
    @Singleton
    public ObjectCache objectCache(EntityCodecRegistry codecs) {
        log.debug("Creating object cache (store: {}, max materialized: {})", clusterName, maxMaterialized);
        return new ObjectCache(codecs, new CacheSettings(clusterName, maxMaterialized), monitor);
    }

    @Produces
    @Singleton
    public ChadoXmlWriter chadoXmlWriter(ObjectCache cache) {
        return new ChadoXmlWriter(cache);
    }

    @Produces
    @Singleton
    public GraphInspector graphInspector(ObjectCache cache) {
        return new GraphInspector(cache);
    }
}
