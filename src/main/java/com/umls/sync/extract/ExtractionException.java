package com.umls.sync.extract;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a release file cannot be extracted completely.
 * No partial snapshot is ever returned alongside this exception.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether extraction stopped because the caller cancelled it.
     */
    public boolean isCancellation() {
        return getCause() instanceof CancellationException;
    }
}
