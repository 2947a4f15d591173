package org.neuralchilli.chadoxml.core;

import org.neuralchilli.chadoxml.domain.EntityKey;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Map;

/**
 * Shape of the graph reachable from an experiment root.
 * Useful for logging before a long write, and for spotting unresolved references.
 */
public record GraphStatistics(
        int entities,
        int references,
        int sharedEntities,
        boolean cyclic,
        Map<String, Integer> entitiesByType,
        List<EntityKey> placeholders
) {
    public GraphStatistics {
        if (entities < 0) {
            throw new IllegalArgumentException("Entities cannot be negative");
        }
        if (references < 0) {
            throw new IllegalArgumentException("References cannot be negative");
        }
        entitiesByType = Map.copyOf(entitiesByType);
        placeholders = List.copyOf(placeholders);
    }

    /**
     * Check if some reachable handle was referenced but never put
     */
    public boolean hasPlaceholders() {
        return !placeholders.isEmpty();
    }

    /**
     * Check if any entity is reachable along more than one path
     */
    public boolean hasSharing() {
        return sharedEntities > 0;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "GraphStatistics[entities=%d, references=%d, shared=%d, cyclic=%s, placeholders=%d]",
                entities, references, sharedEntities, cyclic, placeholders.size()
        );
    }
}
