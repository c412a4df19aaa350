package com.scrapesentinel.core.error;

/**
 * Raised when fetched content cannot be turned into items. Repeated occurrences usually mean
 * the page layout drifted away from the configured selectors.
 */
public class ExtractionException extends ScrapeException {
    private final String sourceKey;

    public ExtractionException(String sourceKey, String message) {
        super(message);
        this.sourceKey = sourceKey;
    }

    public ExtractionException(String sourceKey, String message, Throwable cause) {
        super(message, cause);
        this.sourceKey = sourceKey;
    }

    public String sourceKey() {
        return sourceKey;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
