package org.neuralchilli.chadoxml.cache;

/**
 * Tunables for an {@link ObjectCache}.
 *
 * @param clusterName     name of the embedded backing store
 * @param maxMaterialized resident entity bound, least recently used are compressed first; 0 for no bound
 */
public record CacheSettings(String clusterName, int maxMaterialized) {

    public CacheSettings {
        if (clusterName == null || clusterName.isBlank()) {
            throw new IllegalArgumentException("Cluster name cannot be null or empty");
        }
        if (maxMaterialized < 0) {
            throw new IllegalArgumentException("Max materialized cannot be negative");
        }
    }

    public static CacheSettings unbounded(String clusterName) {
        return new CacheSettings(clusterName, 0);
    }

    public boolean isBounded() {
        return maxMaterialized > 0;
    }
}
