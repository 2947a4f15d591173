package org.neuralchilli.chadoxml;

import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.domain.Analysis;
import org.neuralchilli.chadoxml.domain.AnalysisFeature;
import org.neuralchilli.chadoxml.domain.AppliedProtocol;
import org.neuralchilli.chadoxml.domain.Attribute;
import org.neuralchilli.chadoxml.domain.CV;
import org.neuralchilli.chadoxml.domain.CVTerm;
import org.neuralchilli.chadoxml.domain.DB;
import org.neuralchilli.chadoxml.domain.DBXref;
import org.neuralchilli.chadoxml.domain.Datum;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.domain.ExperimentProp;
import org.neuralchilli.chadoxml.domain.Feature;
import org.neuralchilli.chadoxml.domain.FeatureLoc;
import org.neuralchilli.chadoxml.domain.FeatureRelationship;
import org.neuralchilli.chadoxml.domain.Organism;
import org.neuralchilli.chadoxml.domain.Protocol;

import java.util.List;

/**
 * Experiment graphs built directly in a cache, for tests that do not go through the parser.
 */
public final class ExperimentGraphs {

    private ExperimentGraphs() {
    }

    /**
     * Two steps whose data both point at feature F1.
     */
    public static CachedHandle<Experiment> sharedFeature(ObjectCache cache) {
        CachedHandle<Feature> f1 = cache.put(new Feature("F1", "gene-1", "F1", null, null,
                null, null, null, List.of(), List.of(), List.of()));

        CachedHandle<Datum> d1 = cache.put(new Datum("D1", "genes", "Result File", "genes.gff",
                null, null, List.of(), List.of(f1)));
        CachedHandle<Datum> d2 = cache.put(new Datum("D2", "peaks", "Result File", "peaks.wig",
                null, null, List.of(), List.of(f1)));

        CachedHandle<Protocol> protocol = cache.put(new Protocol("call", "call", null, 1, null, List.of()));
        CachedHandle<AppliedProtocol> step1 = cache.put(new AppliedProtocol("AP1", protocol, List.of(), List.of(d1)));
        CachedHandle<AppliedProtocol> step2 = cache.put(new AppliedProtocol("AP2", protocol, List.of(), List.of(d2)));

        return cache.put(new Experiment("E1", "shared-feature", null, List.of(), List.of(step1, step2)));
    }

    /**
     * Every entity type, with shared vocabulary terms and a feature/analysisfeature cycle.
     */
    public static CachedHandle<Experiment> full(ObjectCache cache) {
        CachedHandle<DB> so = cache.put(new DB("SO", "SO", "http://www.sequenceontology.org/", null));
        CachedHandle<CV> soCv = cache.put(new CV("SO", "SO", "Sequence Ontology"));
        CachedHandle<DBXref> geneXref = cache.put(new DBXref("SO:0000704", "0000704", null, so));
        CachedHandle<CVTerm> gene = cache.put(new CVTerm("SO:gene", "gene", null, false, soCv, geneXref));
        CachedHandle<CVTerm> chromosome = cache.put(new CVTerm("SO:chromosome", "chromosome", null, false, soCv, null));
        CachedHandle<CVTerm> partOf = cache.put(new CVTerm("SO:part_of", "part_of", null, false, soCv, null));

        CachedHandle<Organism> dmel = cache.put(new Organism("dmel", "Drosophila", "melanogaster"));
        CachedHandle<Analysis> analysis = cache.put(new Analysis("A1", "peak calling", "macs", "1.4",
                null, null));

        CachedHandle<Feature> chr2L = cache.put(new Feature("chr2L", "2L", "chr2L", null, 23011544,
                chromosome, dmel, null, List.of(), List.of(), List.of()));

        CachedHandle<Feature> f1 = cache.getOrCreate(Feature.class, "F1");
        CachedHandle<AnalysisFeature> score = cache.put(new AnalysisFeature("1", 12.5, null, 0.001, null,
                f1, analysis));
        cache.put(new Feature("F1", "gene-1", "F1", "ACGT", 4, gene, dmel, null,
                List.of(new FeatureLoc(chr2L, 100, 104, 1, 0)),
                List.of(new FeatureRelationship(partOf, chr2L, 0)),
                List.of(score)));

        CachedHandle<Attribute> attribute = cache.put(new Attribute("1", "protocol_type", null, "grow",
                0, gene, null));
        CachedHandle<Protocol> grow = cache.put(new Protocol("grow", "grow", "Grow flies", 2, null,
                List.of(attribute)));

        CachedHandle<Datum> source = cache.put(new Datum("D1", "flies", "Source Name", "flies",
                null, null, List.of(), List.of()));
        CachedHandle<Datum> result = cache.put(new Datum("D2", "genes", "Result File", "genes.gff",
                gene, null, List.of(attribute), List.of(f1)));

        CachedHandle<AppliedProtocol> step1 = cache.put(new AppliedProtocol("AP1", grow,
                List.of(source), List.of(result)));
        CachedHandle<AppliedProtocol> step2 = cache.put(new AppliedProtocol("AP2", grow,
                List.of(result), List.of()));

        CachedHandle<ExperimentProp> title = cache.put(new ExperimentProp("1", "Investigation Title",
                "Fly genes", 0, null, null));

        return cache.put(new Experiment("E1", "fly-genes", "Genes in flies", List.of(title),
                List.of(step1, step2)));
    }
}
