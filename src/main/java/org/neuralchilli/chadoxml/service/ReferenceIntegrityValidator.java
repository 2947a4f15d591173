package org.neuralchilli.chadoxml.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.chadoxml.core.GraphInspector;
import org.neuralchilli.chadoxml.core.GraphStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Fails the submission if anything reachable from the experiment was referenced but never
 * defined. Such a handle would otherwise be written out as an empty entity.
 */
@ApplicationScoped
public class ReferenceIntegrityValidator implements ExperimentValidator {

    private static final Logger log = LoggerFactory.getLogger(ReferenceIntegrityValidator.class);

    @Inject
    GraphInspector inspector;

    @Override
    public String stageName() {
        return "Checking that every referenced entity is defined";
    }

    @Override
    public ValidationResult validate(ParsedSubmission submission) {
        GraphStatistics statistics = inspector.inspect(submission.experiment());
        log.info("Experiment graph: {}", statistics);
        log.debug("Entities by type: {}", statistics.entitiesByType());

        if (statistics.hasPlaceholders()) {
            List<String> problems = statistics.placeholders().stream()
                    .map(key -> "Referenced " + key.type() + " '" + key.id() + "' is never defined")
                    .collect(Collectors.toList());
            problems.forEach(problem -> log.error("  ✗ {}", problem));
            return ValidationResult.failure(problems);
        }

        if (statistics.cyclic()) {
            log.debug("Experiment graph contains cycles; repeated entities will be written as macro references");
        }
        return ValidationResult.success(submission.experiment());
    }
}
