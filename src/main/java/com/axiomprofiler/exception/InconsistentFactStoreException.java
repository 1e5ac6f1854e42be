package com.axiomprofiler.exception;

/**
 * Thrown when a fact store references an entity it does not contain or violates the
 * discovery order. Graph construction aborts; no partial graph is returned.
 */
public class InconsistentFactStoreException extends RuntimeException {

    public InconsistentFactStoreException(String message) {
        super(message);
    }
}
