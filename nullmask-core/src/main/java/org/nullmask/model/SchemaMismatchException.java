package org.nullmask.model;

/**
 * Raised when a dataset's schema is empty or malformed, or a row is not total over it.
 */
public class SchemaMismatchException extends RuntimeException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
