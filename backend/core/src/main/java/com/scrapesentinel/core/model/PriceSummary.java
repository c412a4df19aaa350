package com.scrapesentinel.core.model;

import java.math.BigDecimal;

/**
 * Aggregate over one product's observations. {@code sourceId} is null when the summary spans
 * every source the product was seen on.
 */
public record PriceSummary(
        String productId,
        String sourceId,
        BigDecimal current,
        BigDecimal min,
        BigDecimal max,
        BigDecimal average,
        int observationCount
) {
}
