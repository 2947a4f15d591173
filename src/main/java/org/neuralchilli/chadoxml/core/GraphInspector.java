package org.neuralchilli.chadoxml.core;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.domain.Entity;
import org.neuralchilli.chadoxml.domain.EntityKey;
import org.neuralchilli.chadoxml.domain.FieldSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Builds a JGraphT view of everything reachable from a root handle and analyzes it.
 * Vertices are handles, so shared entities appear once with several incoming edges.
 * Placeholder handles become vertices but are not expanded.
 */
public class GraphInspector {

    private static final Logger log = LoggerFactory.getLogger(GraphInspector.class);

    private final ObjectCache cache;

    public GraphInspector(ObjectCache cache) {
        if (cache == null) {
            throw new IllegalArgumentException("Object cache cannot be null");
        }
        this.cache = cache;
    }

    /**
     * Build the directed graph of handles reachable from the root.
     * Edges run from the referring entity to the referenced one; cycles are allowed.
     */
    public Graph<CachedHandle<?>, DefaultEdge> reachableGraph(CachedHandle<? extends Entity> root) {
        Graph<CachedHandle<?>, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        Deque<CachedHandle<?>> pending = new ArrayDeque<>();

        graph.addVertex(root);
        pending.push(root);

        while (!pending.isEmpty()) {
            CachedHandle<?> current = pending.pop();
            if (current.isPlaceholder()) {
                continue;
            }
            Entity entity = cache.materialize(current);
            entity.describe(new EdgeCollector(graph, current, pending));
        }

        log.debug("Reachable graph built: {} vertices, {} edges",
                graph.vertexSet().size(),
                graph.edgeSet().size()
        );
        return graph;
    }

    /**
     * All reachable handles of one entity type, ordered by id.
     */
    public <T extends Entity> List<CachedHandle<T>> reachable(CachedHandle<? extends Entity> root, Class<T> type) {
        return reachableGraph(root).vertexSet().stream()
                .filter(handle -> handle.entityClass() == type)
                .map(handle -> cache.getOrCreate(type, handle.id()))
                .sorted(Comparator.comparing(CachedHandle::id))
                .collect(Collectors.toList());
    }

    public GraphStatistics inspect(CachedHandle<? extends Entity> root) {
        Graph<CachedHandle<?>, DefaultEdge> graph = reachableGraph(root);

        int shared = 0;
        Map<String, Integer> byType = new TreeMap<>();
        List<EntityKey> placeholders = new ArrayList<>();

        for (CachedHandle<?> handle : graph.vertexSet()) {
            if (graph.inDegreeOf(handle) > 1) {
                shared++;
            }
            byType.merge(handle.type(), 1, Integer::sum);
            if (handle.isPlaceholder()) {
                placeholders.add(handle.key());
            }
        }
        placeholders.sort(Comparator.comparing(EntityKey::asString));

        boolean cyclic = new CycleDetector<>(graph).detectCycles();

        return new GraphStatistics(
                graph.vertexSet().size(),
                graph.edgeSet().size(),
                shared,
                cyclic,
                byType,
                placeholders
        );
    }

    /**
     * Adds an edge for every reference of one entity, queueing handles not seen before.
     */
    private static final class EdgeCollector implements FieldSink {
        private final Graph<CachedHandle<?>, DefaultEdge> graph;
        private final CachedHandle<?> owner;
        private final Deque<CachedHandle<?>> pending;

        EdgeCollector(Graph<CachedHandle<?>, DefaultEdge> graph, CachedHandle<?> owner, Deque<CachedHandle<?>> pending) {
            this.graph = graph;
            this.owner = owner;
            this.pending = pending;
        }

        @Override
        public void scalar(String name, Object value) {
            // scalars carry no edges
        }

        @Override
        public void reference(String name, CachedHandle<? extends Entity> handle) {
            if (handle == null) {
                return;
            }
            if (graph.addVertex(handle)) {
                pending.push(handle);
            }
            graph.addEdge(owner, handle);
        }

        @Override
        public void group(String name, Consumer<FieldSink> body) {
            body.accept(this);
        }
    }
}
