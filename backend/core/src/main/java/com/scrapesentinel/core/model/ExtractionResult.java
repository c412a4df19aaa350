package com.scrapesentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record ExtractionResult(String sourceKey, List<ItemRecord> items, Instant extractedAt) {
    public ExtractionResult {
        Objects.requireNonNull(sourceKey, "sourceKey is required");
        Objects.requireNonNull(extractedAt, "extractedAt is required");
        items = List.copyOf(items);
    }
}
