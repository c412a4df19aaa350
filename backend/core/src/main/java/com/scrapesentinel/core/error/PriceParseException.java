package com.scrapesentinel.core.error;

public class PriceParseException extends ScrapeException {
    private final String rawValue;

    public PriceParseException(String rawValue, String message) {
        super(message);
        this.rawValue = rawValue;
    }

    public String rawValue() {
        return rawValue;
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
