package org.neuralchilli.chadoxml.cache;

/**
 * Thrown when the cache can no longer vouch for the graph: a stored payload is missing
 * or cannot be decoded, or a handle does not belong to this cache.
 * Not recoverable; the write that triggered it must be abandoned.
 */
public class CacheConsistencyException extends RuntimeException {

    public CacheConsistencyException(String message) {
        super(message);
    }

    public CacheConsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
