package org.neuralchilli.chadoxml.cache;

import javax.annotation.Nonnull;

/**
 * Snapshot of an {@link ObjectCache}.
 */
public record CacheStatistics(
        int handles,
        int materialized,
        int compressed,
        int placeholders,
        long materializations,
        long compressions,
        long hits
) {

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "CacheStatistics[handles=%d, materialized=%d, compressed=%d, placeholders=%d, " +
                        "materializations=%d, compressions=%d, hits=%d]",
                handles, materialized, compressed, placeholders, materializations, compressions, hits
        );
    }
}
