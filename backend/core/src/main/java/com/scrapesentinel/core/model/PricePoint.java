package com.scrapesentinel.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record PricePoint(String productId, String sourceId, BigDecimal price, Instant timestamp) {
    public PricePoint {
        Objects.requireNonNull(productId, "productId is required");
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(price, "price is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
