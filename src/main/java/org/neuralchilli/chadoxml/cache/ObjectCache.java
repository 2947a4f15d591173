package org.neuralchilli.chadoxml.cache;

import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import com.hazelcast.nio.serialization.HazelcastSerializationException;
import org.neuralchilli.chadoxml.config.HazelcastConfig;
import org.neuralchilli.chadoxml.domain.Entity;
import org.neuralchilli.chadoxml.domain.EntityKey;
import org.neuralchilli.chadoxml.monitoring.PerformanceMonitor;
import org.neuralchilli.chadoxml.serializer.EntityCodec;
import org.neuralchilli.chadoxml.serializer.EntityCodecRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide registry of every entity in the experiment graph.
 * <p>
 * Each (type, id) maps to exactly one {@link CachedHandle}. Materialized entities live on
 * their handle; compressed ones live as binary payloads in an embedded Hazelcast map, encoded
 * by the type's {@link EntityCodec}. Compressing and materializing never changes what a
 * reader observes, only how much of the graph is held in memory.
 * <p>
 * Lifecycle: {@link #init()} once, then any operation, then {@link #destroy()} once.
 * Anything outside that window throws {@link CacheLifecycleException}.
 */
public class ObjectCache implements HandleResolver {

    private static final Logger log = LoggerFactory.getLogger(ObjectCache.class);

    static final String STORE_NAME = "compressed-entities";

    private enum Lifecycle {NEW, ACTIVE, DESTROYED}

    private final EntityCodecRegistry codecs;
    private final CacheSettings settings;
    private final PerformanceMonitor monitor;

    private final Map<EntityKey, CachedHandle<?>> handles = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    // Access-ordered; only maintained when the residency bound is on
    private final LinkedHashMap<EntityKey, CachedHandle<?>> resident = new LinkedHashMap<>(64, 0.75f, true);

    private volatile Lifecycle lifecycle = Lifecycle.NEW;
    private HazelcastInstance hazelcast;
    private IMap<String, Entity> store;

    public ObjectCache(EntityCodecRegistry codecs, CacheSettings settings, PerformanceMonitor monitor) {
        if (codecs == null) {
            throw new IllegalArgumentException("Codec registry cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("Cache settings cannot be null");
        }
        this.codecs = codecs;
        this.settings = settings;
        this.monitor = monitor != null ? monitor : new PerformanceMonitor();
    }

    /**
     * Start the backing store. Must be called before any entity is created.
     */
    public synchronized void init() {
        if (lifecycle != Lifecycle.NEW) {
            throw new CacheLifecycleException("Object cache is already " +
                    (lifecycle == Lifecycle.ACTIVE ? "initialized" : "destroyed"));
        }

        log.info("Initializing object cache (store: {}, max materialized: {})",
                settings.clusterName(),
                settings.isBounded() ? settings.maxMaterialized() : "unbounded");

        hazelcast = Hazelcast.newHazelcastInstance(
                HazelcastConfig.storeConfig(settings.clusterName(), codecs, this));
        store = hazelcast.getMap(STORE_NAME);
        lifecycle = Lifecycle.ACTIVE;
    }

    /**
     * Release every handle and the backing store. Must be called exactly once.
     */
    public synchronized void destroy() {
        if (lifecycle != Lifecycle.ACTIVE) {
            throw new CacheLifecycleException(lifecycle == Lifecycle.NEW
                    ? "Object cache destroyed before init()"
                    : "Object cache destroyed more than once");
        }

        log.info("Destroying object cache: {}", statistics());
        lifecycle = Lifecycle.DESTROYED;

        handles.clear();
        synchronized (resident) {
            resident.clear();
        }
        try {
            store.destroy();
        } finally {
            hazelcast.shutdown();
            store = null;
            hazelcast = null;
        }
    }

    public boolean isActive() {
        return lifecycle == Lifecycle.ACTIVE;
    }

    /**
     * Get the handle registered for (type, id), creating a placeholder if there is none.
     *
     * @throws IllegalArgumentException if no codec is registered for the type tag
     */
    public CachedHandle<? extends Entity> getOrCreate(String type, String id) {
        ensureActive();
        return getOrCreate(codecs.forTag(type).entityClass(), id);
    }

    @Override
    public <T extends Entity> CachedHandle<T> getOrCreate(Class<T> type, String id) {
        ensureActive();
        EntityKey key = new EntityKey(codecs.forClass(type).typeTag(), id);
        CachedHandle<?> handle = handles.computeIfAbsent(key,
                k -> new CachedHandle<>(k, type, HandleState.Compressed.EMPTY));
        return checked(handle, type);
    }

    /**
     * Find an existing handle without creating one.
     */
    public <T extends Entity> CachedHandle<T> find(Class<T> type, String id) {
        ensureActive();
        CachedHandle<?> handle = handles.get(new EntityKey(codecs.forClass(type).typeTag(), id));
        return handle == null ? null : checked(handle, type);
    }

    /**
     * Store a freshly built entity under (type, id), replacing whatever the handle held.
     */
    public CachedHandle<? extends Entity> put(String type, String id, Entity entity) {
        EntityCodec<?> codec = codecs.forTag(type);
        if (!codec.entityClass().isInstance(entity)) {
            throw new IllegalArgumentException("Cannot put " + entity.getClass().getSimpleName() +
                    " under type " + type);
        }
        if (!entity.id().equals(id)) {
            throw new IllegalArgumentException("Entity id " + entity.id() + " does not match key id " + id);
        }
        return put(entity);
    }

    @SuppressWarnings("unchecked")
    public <T extends Entity> CachedHandle<T> put(T entity) {
        if (entity == null) {
            throw new IllegalArgumentException("Entity cannot be null");
        }
        CachedHandle<T> handle = getOrCreate((Class<T>) entity.getClass(), entity.id());

        synchronized (handle) {
            if (handle.state() instanceof HandleState.Compressed compressed && compressed.stored()) {
                store.delete(handle.key().asString());
            }
            handle.transition(new HandleState.Materialized(entity));
            handle.markRegistered();
        }

        monitor.recordPut();
        touch(handle);
        return handle;
    }

    /**
     * Get the entity behind a handle, decoding it if it is compressed.
     * A placeholder materializes to its type's blank entity.
     *
     * @throws CacheConsistencyException if the stored payload is missing or cannot be decoded
     */
    public <T extends Entity> T materialize(CachedHandle<T> handle) {
        ensureActive();
        ensureOwned(handle);

        T entity;
        synchronized (handle) {
            HandleState state = handle.state();
            if (state instanceof HandleState.Materialized materialized) {
                monitor.recordCacheHit();
                entity = handle.entityClass().cast(materialized.entity());
            } else {
                boolean placeholder = !((HandleState.Compressed) state).stored();
                entity = placeholder ? blank(handle) : load(handle);
                handle.transition(new HandleState.Materialized(entity));
                monitor.recordMaterialization(placeholder);
            }
        }

        touch(handle);
        return entity;
    }

    /**
     * Move a materialized entity into the backing store. No-op if already compressed.
     */
    public void compress(CachedHandle<? extends Entity> handle) {
        ensureActive();
        ensureOwned(handle);

        synchronized (handle) {
            if (handle.state() instanceof HandleState.Materialized materialized) {
                try {
                    store.set(handle.key().asString(), materialized.entity());
                } catch (HazelcastSerializationException e) {
                    throw new CacheConsistencyException("Cannot encode " + handle.key(), e);
                }
                handle.transition(HandleState.Compressed.STORED);
                monitor.recordCompression();
            }
        }

        untrack(handle);
    }

    /**
     * Compress every materialized entity.
     */
    public int compressAll() {
        ensureActive();
        int count = 0;
        for (CachedHandle<?> handle : handles.values()) {
            if (handle.isMaterialized()) {
                compress(handle);
                count++;
            }
        }
        log.debug("Compressed {} entities", count);
        return count;
    }

    /**
     * Next unused identifier for a type: 1, 2, 3... skipping ids already registered.
     */
    public String newIdentifier(Class<? extends Entity> type) {
        ensureActive();
        String tag = codecs.forClass(type).typeTag();
        AtomicLong sequence = sequences.computeIfAbsent(tag, t -> new AtomicLong());

        String id;
        do {
            id = String.valueOf(sequence.incrementAndGet());
        } while (handles.containsKey(new EntityKey(tag, id)));
        return id;
    }

    public CacheStatistics statistics() {
        int materialized = 0;
        int compressed = 0;
        int placeholders = 0;
        for (CachedHandle<?> handle : handles.values()) {
            if (handle.isPlaceholder()) {
                placeholders++;
            } else if (handle.isMaterialized()) {
                materialized++;
            } else {
                compressed++;
            }
        }
        return new CacheStatistics(
                handles.size(),
                materialized,
                compressed,
                placeholders,
                monitor.getMaterializations(),
                monitor.getCompressions(),
                monitor.getCacheHits()
        );
    }

    public EntityCodecRegistry codecs() {
        return codecs;
    }

    IMap<String, Entity> backingStore() {
        ensureActive();
        return store;
    }

    private <T extends Entity> T blank(CachedHandle<T> handle) {
        return codecs.forClass(handle.entityClass()).blank(handle.id());
    }

    private <T extends Entity> T load(CachedHandle<T> handle) {
        Entity payload;
        try {
            payload = store.get(handle.key().asString());
        } catch (HazelcastSerializationException e) {
            throw new CacheConsistencyException("Stored payload for " + handle.key() + " cannot be decoded", e);
        }

        if (payload == null) {
            throw new CacheConsistencyException("Stored payload for " + handle.key() + " is missing");
        }
        if (!handle.entityClass().isInstance(payload) || !handle.id().equals(payload.id())) {
            throw new CacheConsistencyException("Stored payload for " + handle.key() +
                    " decodes to " + payload.getClass().getSimpleName() + " " + payload.id());
        }
        return handle.entityClass().cast(payload);
    }

    private void touch(CachedHandle<?> handle) {
        if (!settings.isBounded()) {
            return;
        }

        List<CachedHandle<?>> evicted = new ArrayList<>();
        synchronized (resident) {
            resident.put(handle.key(), handle);
            Iterator<CachedHandle<?>> eldest = resident.values().iterator();
            while (resident.size() > settings.maxMaterialized() && eldest.hasNext()) {
                CachedHandle<?> candidate = eldest.next();
                if (candidate != handle) {
                    eldest.remove();
                    evicted.add(candidate);
                }
            }
        }

        for (CachedHandle<?> candidate : evicted) {
            compress(candidate);
            monitor.recordEviction();
        }
    }

    private void untrack(CachedHandle<?> handle) {
        if (settings.isBounded()) {
            synchronized (resident) {
                resident.remove(handle.key());
            }
        }
    }

    private void ensureActive() {
        switch (lifecycle) {
            case NEW -> throw new CacheLifecycleException("Object cache used before init()");
            case DESTROYED -> throw new CacheLifecycleException("Object cache used after destroy()");
            default -> {
            }
        }
    }

    private void ensureOwned(CachedHandle<?> handle) {
        if (handle == null) {
            throw new IllegalArgumentException("Handle cannot be null");
        }
        if (handles.get(handle.key()) != handle) {
            throw new CacheConsistencyException(handle + " does not belong to this cache");
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Entity> CachedHandle<T> checked(CachedHandle<?> handle, Class<T> type) {
        if (handle.entityClass() != type) {
            throw new CacheConsistencyException(handle + " holds " +
                    handle.entityClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return (CachedHandle<T>) handle;
    }
}
