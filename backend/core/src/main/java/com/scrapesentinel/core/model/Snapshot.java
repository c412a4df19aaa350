package com.scrapesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record Snapshot(String label, String sourceKey, String content, Instant timestamp) {
    public Snapshot {
        Objects.requireNonNull(label, "label is required");
        Objects.requireNonNull(sourceKey, "sourceKey is required");
        Objects.requireNonNull(content, "content is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
