package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

/**
 * Scores an analysis assigned to a feature.
 */
public record AnalysisFeature(
        String id,
        Double rawscore,
        Double normscore,
        Double significance,
        Double identity,
        CachedHandle<Feature> feature,
        CachedHandle<Analysis> analysis
) implements Entity {

    public AnalysisFeature {
        Entities.requireId(id, "AnalysisFeature");
    }

    public static AnalysisFeature blank(String id) {
        return new AnalysisFeature(id, null, null, null, null, null, null);
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("rawscore", rawscore);
        sink.scalar("normscore", normscore);
        sink.scalar("significance", significance);
        sink.scalar("identity", identity);
        sink.reference("feature_id", feature);
        sink.reference("analysis_id", analysis);
    }
}
