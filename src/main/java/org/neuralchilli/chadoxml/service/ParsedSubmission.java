package org.neuralchilli.chadoxml.service;

import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.domain.DB;
import org.neuralchilli.chadoxml.domain.Experiment;
import org.neuralchilli.chadoxml.domain.Protocol;

import java.util.List;

/**
 * What the description parser hands to the validators: the experiment root plus the
 * protocols and term sources the description declared.
 */
public record ParsedSubmission(
        CachedHandle<Experiment> experiment,
        List<CachedHandle<Protocol>> protocols,
        List<CachedHandle<DB>> termSources
) {
    public ParsedSubmission {
        if (experiment == null) {
            throw new IllegalArgumentException("Experiment cannot be null");
        }
        protocols = protocols == null ? List.of() : List.copyOf(protocols);
        termSources = termSources == null ? List.of() : List.copyOf(termSources);
    }

    public ParsedSubmission withExperiment(CachedHandle<Experiment> next) {
        return new ParsedSubmission(next, protocols, termSources);
    }
}
