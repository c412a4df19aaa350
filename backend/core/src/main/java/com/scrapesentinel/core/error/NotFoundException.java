package com.scrapesentinel.core.error;

public class NotFoundException extends ScrapeException {
    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
