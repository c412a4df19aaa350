package com.scrapesentinel.core.error;

/**
 * Base type for failures raised by the scrape pipeline. {@link #retryable()} tells the scheduler
 * whether the failure should count towards a job's retry budget or end the job.
 */
public abstract class ScrapeException extends RuntimeException {
    protected ScrapeException(String message) {
        super(message);
    }

    protected ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean retryable();
}
