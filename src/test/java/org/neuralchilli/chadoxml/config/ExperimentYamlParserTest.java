package org.neuralchilli.chadoxml.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.cache.TestCaches;
import org.neuralchilli.chadoxml.domain.AnalysisFeature;
import org.neuralchilli.chadoxml.domain.AppliedProtocol;
import org.neuralchilli.chadoxml.domain.CV;
import org.neuralchilli.chadoxml.domain.CVTerm;
import org.neuralchilli.chadoxml.domain.DB;
import org.neuralchilli.chadoxml.domain.DBXref;
import org.neuralchilli.chadoxml.domain.Datum;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.domain.ExperimentProp;
import org.neuralchilli.chadoxml.domain.Feature;
import org.neuralchilli.chadoxml.domain.Protocol;
import org.neuralchilli.chadoxml.service.ParsedSubmission;
import org.neuralchilli.chadoxml.service.SubmissionLoadException;

import java.io.InputStream;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for ExperimentYamlParser against the description format in src/test/resources/submissions.
 */
class ExperimentYamlParserTest {

    private ObjectCache cache;
    private ExperimentYamlParser parser;

    @BeforeEach
    void setup() {
        cache = TestCaches.started();
        parser = new ExperimentYamlParser(cache);
    }

    @AfterEach
    void cleanup() {
        TestCaches.destroyQuietly(cache);
    }

    @Test
    void shouldParseCompleteDescription() throws Exception {
        // When
        ParsedSubmission submission = parseResource("fly-genes.yaml");

        // Then: Root and declarations
        Experiment experiment = cache.materialize(submission.experiment());
        assertThat(experiment.id()).isEqualTo("E1");
        assertThat(experiment.uniquename()).isEqualTo("fly-genes");
        assertThat(experiment.properties()).extracting(CachedHandle::id).containsExactly("1", "2");
        assertThat(experiment.appliedProtocols()).extracting(CachedHandle::id).containsExactly("AP1", "AP2");
        assertThat(submission.protocols()).extracting(CachedHandle::id).containsExactly("grow", "annotate");
        assertThat(submission.termSources()).extracting(CachedHandle::id)
                .containsExactly("MO", "SO", "modencode_wiki");

        ExperimentProp design = cache.materialize(experiment.properties().get(1));
        assertThat(design.rank()).isEqualTo(1);
        assertThat(design.type().id()).isEqualTo("MO:design_type");
    }

    @Test
    void shouldShareHandlesBetweenReferences() throws Exception {
        ParsedSubmission submission = parseResource("fly-genes.yaml");
        Experiment experiment = cache.materialize(submission.experiment());

        AppliedProtocol grow = cache.materialize(experiment.appliedProtocols().get(0));
        AppliedProtocol annotate = cache.materialize(experiment.appliedProtocols().get(1));

        // One handle for D1 wherever it is used
        assertThat(grow.outputs().get(0)).isSameAs(annotate.inputs().get(0));
        assertThat(grow.protocol()).isSameAs(submission.protocols().get(0));

        // One handle for SO:gene wherever it is used
        Datum genes = cache.materialize(annotate.outputs().get(0));
        Feature f1 = cache.materialize(genes.features().get(0));
        assertThat(genes.type()).isSameAs(f1.type());
    }

    @Test
    void shouldParseFeatureDetails() throws Exception {
        parseResource("fly-genes.yaml");

        Feature f1 = cache.materialize(cache.find(Feature.class, "F1"));
        assertThat(f1.uniquename()).isEqualTo("F1");
        assertThat(f1.organism().id()).isEqualTo("dmel");
        assertThat(f1.locations()).hasSize(1);
        assertThat(f1.locations().get(0).srcfeature()).isSameAs(cache.find(Feature.class, "chr2L"));
        assertThat(f1.locations().get(0).fmax()).isEqualTo(900);
        assertThat(f1.relationships().get(0).type().id()).isEqualTo("SO:part_of");

        AnalysisFeature score = cache.materialize(f1.analysisFeatures().get(0));
        assertThat(score.rawscore()).isEqualTo(0.97);
        assertThat(score.feature()).isSameAs(cache.find(Feature.class, "F1"));
        assertThat(score.analysis().id()).isEqualTo("A1");
    }

    @Test
    void shouldRegisterVocabularyForTerms() throws Exception {
        parseResource("fly-genes.yaml");

        CVTerm gene = cache.materialize(cache.find(CVTerm.class, "SO:gene"));
        assertThat(gene.name()).isEqualTo("gene");
        assertThat(gene.dbxref()).isNull();
        assertThat(cache.materialize(gene.cv()).name()).isEqualTo("SO");
        assertThat(cache.find(CV.class, "MO").isPlaceholder()).isFalse();

        Protocol grow = cache.materialize(cache.find(Protocol.class, "grow"));
        DBXref wiki = cache.materialize(grow.dbxref());
        assertThat(wiki.accession()).isEqualTo("Grow_Embryos:3");
        assertThat(wiki.db()).isSameAs(cache.find(DB.class, "modencode_wiki"));
        assertThat(grow.attributes()).hasSize(1);
    }

    @Test
    void shouldLeaveUndeclaredProtocolAsPlaceholder() throws Exception {
        ParsedSubmission submission = parseResource("undeclared-protocol.yaml");

        AppliedProtocol step = cache.materialize(
                cache.materialize(submission.experiment()).appliedProtocols().get(0));

        assertThat(step.protocol().id()).isEqualTo("extract");
        assertThat(step.protocol().isPlaceholder()).isTrue();
    }

    @Test
    void shouldAssignExperimentIdWhenMissing() {
        ParsedSubmission submission = parser.parse("""
                experiment:
                  uniquename: minimal
                """);

        assertThat(submission.experiment().id()).isEqualTo("1");
        assertThat(submission.protocols()).isEmpty();
    }

    @Test
    void shouldRejectMissingRequiredField() {
        assertThatThrownBy(() -> parser.parse("""
                experiment:
                  uniquename: no-heading
                data:
                  - id: D1
                    value: embryos
                """))
                .isInstanceOf(SubmissionLoadException.class)
                .hasMessageContaining("heading");
    }

    @Test
    void shouldRejectMissingExperiment() {
        assertThatThrownBy(() -> parser.parse("protocols: []"))
                .isInstanceOf(SubmissionLoadException.class)
                .hasMessageContaining("experiment");
    }

    @Test
    void shouldRejectBadTermReference() {
        assertThatThrownBy(() -> parser.parse("""
                experiment:
                  uniquename: bad-term
                  properties:
                    - name: Organism
                      type: organism
                """))
                .isInstanceOf(SubmissionLoadException.class)
                .hasMessageContaining("cv:term");
    }

    @Test
    void shouldRejectStepIdTakenByEarlierStep() {
        // Given: The first step gets id 1 assigned, the second claims it explicitly
        String yaml = """
                experiment:
                  uniquename: colliding-steps
                protocols:
                  - name: grow
                  - name: annotate
                steps:
                  - protocol: grow
                  - id: "1"
                    protocol: annotate
                """;

        // Then
        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(SubmissionLoadException.class)
                .hasMessageContaining("Duplicate applied_protocol id: 1");
    }

    @Test
    void shouldRejectFeatureDefinedTwice() {
        String yaml = """
                experiment:
                  uniquename: colliding-features
                features:
                  - id: F1
                    name: first
                  - id: F1
                    name: second
                """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(SubmissionLoadException.class)
                .hasMessageContaining("Duplicate feature id: F1");
        assertThat(cache.materialize(cache.find(Feature.class, "F1")).name()).isEqualTo("first");
    }

    @Test
    void shouldRejectTermSourceDeclaredTwice() {
        assertThatThrownBy(() -> parser.parse("""
                experiment:
                  uniquename: colliding-sources
                term_sources:
                  - name: SO
                  - name: SO
                """))
                .isInstanceOf(SubmissionLoadException.class)
                .hasMessageContaining("Duplicate db id: SO");
    }

    @Test
    void shouldFillPlaceholderReferencedBeforeDefinition() {
        // Location on chr2L is read before chr2L itself is defined
        parser.parse("""
                experiment:
                  uniquename: forward-reference
                features:
                  - id: F1
                    locations:
                      - {srcfeature: chr2L, fmin: 1, fmax: 5}
                  - id: chr2L
                    name: 2L
                """);

        assertThat(cache.find(Feature.class, "chr2L").isPlaceholder()).isFalse();
    }

    @Test
    void shouldRejectMalformedYaml() {
        assertThatThrownBy(() -> parseResource("malformed.yaml"))
                .isInstanceOf(SubmissionLoadException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void shouldRejectNonMappingDocument() {
        assertThatThrownBy(() -> parser.parse("- just\n- a list\n"))
                .isInstanceOf(SubmissionLoadException.class);
    }

    @Test
    void shouldRejectMissingFile() {
        assertThatThrownBy(() -> parser.parse(Path.of("does-not-exist.yaml")))
                .isInstanceOf(SubmissionLoadException.class)
                .hasMessageContaining("not found");
    }

    private ParsedSubmission parseResource(String name) throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/submissions/" + name)) {
            assertThat(in).as("resource %s", name).isNotNull();
            return parser.parse(in);
        }
    }
}
