package org.neuralchilli.chadoxml.service;

import org.neuralchilli.chadoxml.cache.CachedHandle;
import org.neuralchilli.chadoxml.domain.Experiment;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one validation stage.
 * A failure's problems have already been logged by the validator that found them.
 */
public sealed interface ValidationResult {

    boolean isSuccess();

    /**
     * The experiment root to hand to the next stage, if the stage passed
     */
    Optional<CachedHandle<Experiment>> experiment();

    List<String> problems();

    record Success(CachedHandle<Experiment> root) implements ValidationResult {
        public Success {
            if (root == null) {
                throw new IllegalArgumentException("Experiment cannot be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<CachedHandle<Experiment>> experiment() {
            return Optional.of(root);
        }

        @Override
        public List<String> problems() {
            return List.of();
        }
    }

    record Failure(List<String> problems) implements ValidationResult {
        public Failure {
            problems = List.copyOf(problems);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<CachedHandle<Experiment>> experiment() {
            return Optional.empty();
        }
    }

    static ValidationResult success(CachedHandle<Experiment> experiment) {
        return new Success(experiment);
    }

    static ValidationResult failure(List<String> problems) {
        return new Failure(problems);
    }

    static ValidationResult failure(String problem) {
        return new Failure(List.of(problem));
    }
}
