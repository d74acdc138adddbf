package com.architecture.migration.impact.service.extract;

/**
 * A single file could not be analyzed. The graph builder skips the file and carries on.
 */
public class FactExtractionException extends RuntimeException {

    public FactExtractionException(String message) {
        super(message);
    }

    public FactExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
