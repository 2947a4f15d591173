package org.neuralchilli.chadoxml.core;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.chadoxml.ExperimentGraphs;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.cache.TestCaches;
import org.neuralchilli.chadoxml.domain.CVTerm;
import org.neuralchilli.chadoxml.domain.Datum;
import org.neuralchilli.chadoxml.domain.EntityKey;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.domain.Feature;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GraphInspectorTest {

    private ObjectCache cache;
    private GraphInspector inspector;

    @BeforeEach
    void setup() {
        cache = TestCaches.started();
        inspector = new GraphInspector(cache);
    }

    @AfterEach
    void cleanup() {
        TestCaches.destroyQuietly(cache);
    }

    @Test
    void shouldCountSharedFeature() {
        // Given
        CachedHandle<Experiment> root = ExperimentGraphs.sharedFeature(cache);

        // When
        GraphStatistics statistics = inspector.inspect(root);

        // Then: E1, AP1, AP2, call, D1, D2, F1
        assertThat(statistics.entities()).isEqualTo(7);
        assertThat(statistics.cyclic()).isFalse();
        assertThat(statistics.hasSharing()).isTrue();
        assertThat(statistics.sharedEntities()).isEqualTo(2);
        assertThat(statistics.entitiesByType()).containsEntry("feature", 1).containsEntry("data", 2);
        assertThat(statistics.hasPlaceholders()).isFalse();
    }

    @Test
    void shouldDetectCycle() {
        CachedHandle<Experiment> root = ExperimentGraphs.full(cache);

        GraphStatistics statistics = inspector.inspect(root);

        assertThat(statistics.cyclic()).isTrue();
    }

    @Test
    void shouldReportPlaceholdersWithoutExpandingThem() {
        // Given: A datum pointing at a feature that is never defined
        CachedHandle<Feature> missing = cache.getOrCreate(Feature.class, "F9");
        CachedHandle<Datum> datum = cache.put(new Datum("D1", null, "Result File", null,
                null, null, List.of(), List.of(missing)));

        // When
        Graph<CachedHandle<?>, DefaultEdge> graph = inspector.reachableGraph(datum);
        GraphStatistics statistics = inspector.inspect(datum);

        // Then
        assertThat(graph.vertexSet()).containsExactlyInAnyOrder(datum, missing);
        assertThat(graph.outDegreeOf(missing)).isZero();
        assertThat(missing.isMaterialized()).isFalse();
        assertThat(statistics.placeholders()).containsExactly(new EntityKey("feature", "F9"));
    }

    @Test
    void shouldListReachableEntitiesOfOneTypeById() {
        CachedHandle<Experiment> root = ExperimentGraphs.full(cache);

        List<CachedHandle<CVTerm>> terms = inspector.reachable(root, CVTerm.class);

        assertThat(terms).extracting(CachedHandle::id)
                .containsExactly("SO:chromosome", "SO:gene", "SO:part_of");
    }
}
