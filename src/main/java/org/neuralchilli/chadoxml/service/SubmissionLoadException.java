package org.neuralchilli.chadoxml.service;

/**
 * Thrown when an experiment description cannot be read or is malformed.
 */
public class SubmissionLoadException extends RuntimeException {

    public SubmissionLoadException(String message) {
        super(message);
    }

    public SubmissionLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
