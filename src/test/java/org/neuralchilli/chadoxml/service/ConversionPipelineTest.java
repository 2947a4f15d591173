package org.neuralchilli.chadoxml.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.cache.TestCaches;
import org.neuralchilli.chadoxml.config.ExperimentYamlParser;
import org.neuralchilli.chadoxml.core.ChadoXmlWriteException;
import org.neuralchilli.chadoxml.core.ChadoXmlWriter;
import org.neuralchilli.chadoxml.core.WriteSummary;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.monitoring.PerformanceMonitor;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Stage ordering and failure handling of ConversionPipeline, with every stage mocked.
 */
class ConversionPipelineTest {

    private static final Path INPUT = Path.of("experiment.yaml");
    private static final Path OUTPUT = Path.of("experiment.chadoxml");

    private ObjectCache cache;
    private ConversionPipeline pipeline;
    private CachedHandle<Experiment> root;
    private ParsedSubmission submission;

    @BeforeEach
    void setup() {
        cache = TestCaches.started();
        root = cache.put(new Experiment("E1", "pipeline", null, List.of(), List.of()));
        submission = new ParsedSubmission(root, List.of(), List.of());

        pipeline = new ConversionPipeline();
        pipeline.cache = cache;
        pipeline.monitor = new PerformanceMonitor();
        pipeline.parser = mock(ExperimentYamlParser.class);
        pipeline.protocolValidator = mock(ProtocolValidator.class);
        pipeline.termSourceValidator = mock(TermSourceValidator.class);
        pipeline.referenceIntegrityValidator = mock(ReferenceIntegrityValidator.class);
        pipeline.writer = mock(ChadoXmlWriter.class);

        when(pipeline.protocolValidator.stageName()).thenReturn("protocols");
        when(pipeline.termSourceValidator.stageName()).thenReturn("term sources");
        when(pipeline.referenceIntegrityValidator.stageName()).thenReturn("references");

        when(pipeline.parser.parse(INPUT)).thenReturn(submission);
        for (ExperimentValidator validator : pipeline.validators()) {
            when(validator.validate(any(ParsedSubmission.class))).thenReturn(ValidationResult.success(root));
        }
        when(pipeline.writer.write(root, OUTPUT)).thenReturn(new WriteSummary(1, 0, 0));
    }

    @AfterEach
    void cleanup() {
        TestCaches.destroyQuietly(cache);
    }

    @Test
    void shouldRunEveryStageInOrder() {
        // When
        boolean converted = pipeline.convert(INPUT, OUTPUT);

        // Then
        assertThat(converted).isTrue();
        InOrder order = inOrder(pipeline.parser, pipeline.protocolValidator, pipeline.termSourceValidator,
                pipeline.referenceIntegrityValidator, pipeline.writer);
        order.verify(pipeline.parser).parse(INPUT);
        order.verify(pipeline.protocolValidator).validate(submission);
        order.verify(pipeline.termSourceValidator).validate(submission);
        order.verify(pipeline.referenceIntegrityValidator).validate(submission);
        order.verify(pipeline.writer).write(root, OUTPUT);

        assertThat(pipeline.monitor.getTimingStats("parse").getCount()).isEqualTo(1);
        assertThat(pipeline.monitor.getTimingStats("write").getCount()).isEqualTo(1);
    }

    @Test
    void shouldStopAtFirstFailedValidator() {
        // Given: Protocol check fails
        when(pipeline.protocolValidator.validate(any(ParsedSubmission.class)))
                .thenReturn(ValidationResult.failure("Applied protocol AP1 refers to undeclared protocol 'x'"));

        // When
        boolean converted = pipeline.convert(INPUT, OUTPUT);

        // Then: Nothing after it runs
        assertThat(converted).isFalse();
        verify(pipeline.termSourceValidator, never()).validate(any());
        verify(pipeline.referenceIntegrityValidator, never()).validate(any());
        verifyNoInteractions(pipeline.writer);
    }

    @Test
    void shouldStopWhenDescriptionCannotBeRead() {
        when(pipeline.parser.parse(INPUT)).thenThrow(new SubmissionLoadException("Malformed experiment description"));

        assertThat(pipeline.convert(INPUT, OUTPUT)).isFalse();

        verify(pipeline.protocolValidator, never()).validate(any());
        verifyNoInteractions(pipeline.writer);
    }

    @Test
    void shouldReportWriteFailure() {
        when(pipeline.writer.write(root, OUTPUT))
                .thenThrow(new ChadoXmlWriteException("Cannot open experiment.chadoxml for writing"));

        assertThat(pipeline.convert(INPUT, OUTPUT)).isFalse();
    }

    @Test
    void shouldHandValidatorRootToLaterStages() {
        // Given: Term source resolution replaces the root
        CachedHandle<Experiment> replaced = cache.put(new Experiment("E2", "replaced", null, List.of(), List.of()));
        when(pipeline.termSourceValidator.validate(any(ParsedSubmission.class)))
                .thenReturn(ValidationResult.success(replaced));
        when(pipeline.writer.write(replaced, OUTPUT)).thenReturn(new WriteSummary(1, 0, 0));

        // When
        assertThat(pipeline.convert(INPUT, OUTPUT)).isTrue();

        // Then
        verify(pipeline.referenceIntegrityValidator).validate(submission.withExperiment(replaced));
        verify(pipeline.writer).write(replaced, OUTPUT);
    }

    @Test
    void shouldCompressAfterEachStageWhenConfigured() {
        pipeline.compressAfterStage = true;

        assertThat(pipeline.convert(INPUT, OUTPUT)).isTrue();

        assertThat(root.isMaterialized()).isFalse();
        assertThat(cache.statistics().compressions()).isGreaterThanOrEqualTo(1);
    }
}
