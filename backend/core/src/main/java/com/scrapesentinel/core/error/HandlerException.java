package com.scrapesentinel.core.error;

public class HandlerException extends ScrapeException {
    private final String eventType;

    public HandlerException(String eventType, Throwable cause) {
        super("Callback handler failed for " + eventType + ": " + cause.getMessage(), cause);
        this.eventType = eventType;
    }

    public String eventType() {
        return eventType;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
