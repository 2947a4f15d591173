package org.neuralchilli.chadoxml.cache;

import org.neuralchilli.chadoxml.domain.Entity;

/**
 * Hands out the canonical handle for a key. Codecs use this to rebuild references
 * without materializing the referenced entities.
 */
public interface HandleResolver {

    <T extends Entity> CachedHandle<T> getOrCreate(Class<T> type, String id);
}
