package com.scrapesentinel.core.model;

import java.time.Duration;
import java.util.Objects;

public record JobDefinition(String name, ScrapeTarget target, Duration interval, int maxRetries) {
    public JobDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(interval, "interval is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
    }
}
