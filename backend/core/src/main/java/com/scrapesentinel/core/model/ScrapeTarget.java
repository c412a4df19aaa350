package com.scrapesentinel.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record ScrapeTarget(
        String sourceKey,
        String url,
        Map<String, String> headers,
        SelectorSpec selectors,
        PriceFields priceFields
) {
    public ScrapeTarget {
        Objects.requireNonNull(sourceKey, "sourceKey is required");
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(selectors, "selectors is required");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public Optional<PriceFields> priceTracking() {
        return Optional.ofNullable(priceFields);
    }
}
