package org.neuralchilli.chadoxml.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.domain.AppliedProtocol;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.domain.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Checks that every applied protocol refers to a protocol the description declared.
 * Declared protocols that no step applies are reported as warnings only.
 */
@ApplicationScoped
public class ProtocolValidator implements ExperimentValidator {

    private static final Logger log = LoggerFactory.getLogger(ProtocolValidator.class);

    @Inject
    ObjectCache cache;

    @Override
    public String stageName() {
        return "Merging applied protocols with declared protocols";
    }

    @Override
    public ValidationResult validate(ParsedSubmission submission) {
        Set<CachedHandle<Protocol>> declared = Collections.newSetFromMap(new IdentityHashMap<>());
        declared.addAll(submission.protocols());
        Set<CachedHandle<Protocol>> applied = Collections.newSetFromMap(new IdentityHashMap<>());

        Experiment experiment = cache.materialize(submission.experiment());
        List<String> problems = new ArrayList<>();

        if (experiment.appliedProtocols().isEmpty()) {
            problems.add("Experiment " + experiment.id() + " has no applied protocols");
        }

        for (CachedHandle<AppliedProtocol> stepHandle : experiment.appliedProtocols()) {
            AppliedProtocol step = cache.materialize(stepHandle);

            if (step.protocol() == null) {
                problems.add("Applied protocol " + step.id() + " has no protocol");
                continue;
            }
            if (!declared.contains(step.protocol())) {
                problems.add("Applied protocol " + step.id() + " refers to undeclared protocol '" +
                        step.protocol().id() + "'");
            }
            if (step.inputs().isEmpty() && step.outputs().isEmpty()) {
                log.warn("Applied protocol {} has neither inputs nor outputs", step.id());
            }
            applied.add(step.protocol());
        }

        for (CachedHandle<Protocol> protocol : submission.protocols()) {
            if (!applied.contains(protocol)) {
                log.warn("Protocol '{}' is declared but never applied", protocol.id());
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("  ✗ {}", problem));
            return ValidationResult.failure(problems);
        }

        log.debug("{} applied protocols use {} declared protocols",
                experiment.appliedProtocols().size(), applied.size());
        return ValidationResult.success(submission.experiment());
    }
}
