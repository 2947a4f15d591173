package org.neuralchilli.chadoxml.core;

/**
 * Thrown when the ChadoXML document cannot be written. Whatever was written is discarded.
 */
public class ChadoXmlWriteException extends RuntimeException {

    public ChadoXmlWriteException(String message) {
        super(message);
    }

    public ChadoXmlWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
