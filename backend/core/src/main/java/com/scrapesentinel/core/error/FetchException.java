package com.scrapesentinel.core.error;

public class FetchException extends ScrapeException {
    private final String url;
    private final int status;

    public FetchException(String url, String message) {
        this(url, 0, message, null);
    }

    public FetchException(String url, String message, Throwable cause) {
        this(url, 0, message, cause);
    }

    public FetchException(String url, int status, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = status;
    }

    public String url() {
        return url;
    }

    /**
     * HTTP status that caused the failure, or 0 when no response was received.
     */
    public int status() {
        return status;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
