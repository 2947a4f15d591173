package org.neuralchilli.chadoxml.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.config.ExperimentYamlParser;
import org.neuralchilli.chadoxml.core.ChadoXmlWriteException;
import org.neuralchilli.chadoxml.core.ChadoXmlWriter;
import org.neuralchilli.chadoxml.core.WriteSummary;
import org.neuralchilli.chadoxml.monitoring.PerformanceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs a submission through parse, validation and ChadoXML output, stopping at the first
 * stage that fails. Diagnostics go to the log only.
 */
@ApplicationScoped
public class ConversionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConversionPipeline.class);

    @Inject
    ExperimentYamlParser parser;

    @Inject
    ProtocolValidator protocolValidator;

    @Inject
    TermSourceValidator termSourceValidator;

    @Inject
    ReferenceIntegrityValidator referenceIntegrityValidator;

    @Inject
    ChadoXmlWriter writer;

    @Inject
    ObjectCache cache;

    @Inject
    PerformanceMonitor monitor;

    @ConfigProperty(name = "chadoxml.cache.compress-after-stage", defaultValue = "false")
    boolean compressAfterStage;

    /**
     * Convert one submission.
     *
     * @param input  experiment description
     * @param output destination file, or null for standard output
     * @return true if the document was written completely
     */
    public boolean convert(Path input, Path output) {
        log.info("Validating submission {}", input);

        ParsedSubmission submission;
        log.info("Reading experiment description...");
        try (PerformanceMonitor.Timer timer = monitor.startTimer("parse")) {
            submission = parser.parse(input);
        } catch (SubmissionLoadException e) {
            log.error("✗ Failed to read {}: {}", input, e.getMessage());
            return false;
        }
        stageDone();

        for (ExperimentValidator validator : validators()) {
            log.info("{}...", validator.stageName());

            ValidationResult result;
            try (PerformanceMonitor.Timer timer = monitor.startTimer(validator.stageName())) {
                result = validator.validate(submission);
            }
            if (!result.isSuccess()) {
                log.error("✗ Failed with {} problem(s).", result.problems().size());
                return false;
            }
            submission = submission.withExperiment(result.experiment().orElseThrow());
            stageDone();
        }
        log.info("Validated successfully!");

        log.info("Writing ChadoXML; this may take a while...");
        try (PerformanceMonitor.Timer timer = monitor.startTimer("write")) {
            WriteSummary summary = output == null
                    ? writer.write(submission.experiment(), System.out)
                    : writer.write(submission.experiment(), output);
            log.info("✓ Done. All tasks complete ({} entities, {} references).",
                    summary.entities(), summary.references());
        } catch (ChadoXmlWriteException e) {
            log.error("✗ Failed to write ChadoXML: {}", e.getMessage(), e);
            return false;
        }

        monitor.logReport();
        return true;
    }

    List<ExperimentValidator> validators() {
        return List.of(protocolValidator, termSourceValidator, referenceIntegrityValidator);
    }

    private void stageDone() {
        if (compressAfterStage) {
            int compressed = cache.compressAll();
            log.debug("Compressed {} entities after stage", compressed);
        }
        log.info("✓ Done.");
    }
}
