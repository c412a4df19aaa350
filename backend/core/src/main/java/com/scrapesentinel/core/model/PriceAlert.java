package com.scrapesentinel.core.model;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceAlert(
        String productId,
        String sourceId,
        BigDecimal previousPrice,
        BigDecimal newPrice,
        BigDecimal pctChange,
        PriceDirection direction,
        Instant timestamp
) {
}
