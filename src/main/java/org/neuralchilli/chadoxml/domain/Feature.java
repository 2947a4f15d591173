package org.neuralchilli.chadoxml.domain;

import org.neuralchilli.chadoxml.cache.CachedHandle;

import java.util.List;

/**
 * A sequence feature. Locations and relationships to other features are embedded values;
 * relationships may form cycles, and analysis features point back at this feature.
 */
public record Feature(
        String id,
        String name,
        String uniquename,
        String residues,
        Integer seqlen,
        CachedHandle<CVTerm> type,
        CachedHandle<Organism> organism,
        CachedHandle<DBXref> dbxref,
        List<FeatureLoc> locations,
        List<FeatureRelationship> relationships,
        List<CachedHandle<AnalysisFeature>> analysisFeatures
) implements Entity {

    public Feature {
        Entities.requireId(id, "Feature");
        locations = Entities.copy(locations);
        relationships = Entities.copy(relationships);
        analysisFeatures = Entities.copy(analysisFeatures);
    }

    public static Feature blank(String id) {
        return new Feature(id, null, null, null, null, null, null, null, List.of(), List.of(), List.of());
    }

    @Override
    public void describe(FieldSink sink) {
        sink.scalar("name", name);
        sink.scalar("uniquename", uniquename);
        sink.scalar("residues", residues);
        sink.scalar("seqlen", seqlen);
        sink.reference("type_id", type);
        sink.reference("organism_id", organism);
        sink.reference("dbxref_id", dbxref);
        for (FeatureLoc location : locations) {
            sink.group("featureloc", location::describe);
        }
        for (FeatureRelationship relationship : relationships) {
            sink.group("feature_relationship", relationship::describe);
        }
        sink.references("analysisfeature_id", analysisFeatures);
    }
}
