package org.neuralchilli.chadoxml.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.cache.TestCaches;
import org.neuralchilli.chadoxml.domain.AppliedProtocol;
import org.neuralchilli.chadoxml.domain.Datum;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.domain.Protocol;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProtocolValidatorTest {

    private ObjectCache cache;
    private ProtocolValidator validator;

    @BeforeEach
    void setup() {
        cache = TestCaches.started();
        validator = new ProtocolValidator();
        validator.cache = cache;
    }

    @AfterEach
    void cleanup() {
        TestCaches.destroyQuietly(cache);
    }

    @Test
    void shouldAcceptStepsUsingDeclaredProtocols() {
        // Given: One declared protocol used by the only step, one declared but unused
        CachedHandle<Protocol> grow = cache.put(new Protocol("grow", "grow", null, 1, null, List.of()));
        CachedHandle<Protocol> unused = cache.put(new Protocol("wash", "wash", null, 1, null, List.of()));
        CachedHandle<Experiment> root = experimentWithStep(grow);

        // When
        ValidationResult result = validator.validate(new ParsedSubmission(root, List.of(grow, unused), List.of()));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.experiment()).containsSame(root);
        assertThat(result.problems()).isEmpty();
    }

    @Test
    void shouldRejectUndeclaredProtocol() {
        CachedHandle<Protocol> grow = cache.put(new Protocol("grow", "grow", null, 1, null, List.of()));
        CachedHandle<Protocol> extract = cache.getOrCreate(Protocol.class, "extract");
        CachedHandle<Experiment> root = experimentWithStep(extract);

        ValidationResult result = validator.validate(new ParsedSubmission(root, List.of(grow), List.of()));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.experiment()).isEmpty();
        assertThat(result.problems()).singleElement().asString()
                .contains("AP1")
                .contains("undeclared protocol 'extract'");
    }

    @Test
    void shouldRejectExperimentWithoutSteps() {
        CachedHandle<Experiment> root = cache.put(new Experiment("E1", "empty", null, List.of(), List.of()));

        ValidationResult result = validator.validate(new ParsedSubmission(root, List.of(), List.of()));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.problems()).singleElement().asString().contains("no applied protocols");
    }

    private CachedHandle<Experiment> experimentWithStep(CachedHandle<Protocol> protocol) {
        CachedHandle<Datum> input = cache.put(new Datum("D1", null, "Source Name", "embryos",
                null, null, List.of(), List.of()));
        CachedHandle<AppliedProtocol> step = cache.put(new AppliedProtocol("AP1", protocol,
                List.of(input), List.of()));
        return cache.put(new Experiment("E1", "protocols", null, List.of(), List.of(step)));
    }
}
