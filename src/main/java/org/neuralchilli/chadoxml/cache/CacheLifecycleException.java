package org.neuralchilli.chadoxml.cache;

/**
 * Thrown when the cache is used before {@code init()} or after {@code destroy()}.
 */
public class CacheLifecycleException extends IllegalStateException {

    public CacheLifecycleException(String message) {
        super(message);
    }
}
