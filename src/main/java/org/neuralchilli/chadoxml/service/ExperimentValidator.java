package org.neuralchilli.chadoxml.service;

/**
 * One stage of the validation pipeline.
 * Validators may replace entities in the cache; they return the (possibly new) root.
 */
public interface ExperimentValidator {

    /**
     * Short description for stage logging
     */
    String stageName();

    ValidationResult validate(ParsedSubmission submission);
}
