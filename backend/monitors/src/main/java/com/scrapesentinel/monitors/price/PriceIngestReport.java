package com.scrapesentinel.monitors.price;

import com.scrapesentinel.core.model.PriceAlert;

import java.util.List;

public record PriceIngestReport(int tracked, List<PriceAlert> alerts, List<ItemError> errors) {
    public PriceIngestReport {
        alerts = List.copyOf(alerts);
        errors = List.copyOf(errors);
    }

    /**
     * An item that was skipped during ingestion. {@code index} is the item's position in the extraction.
     */
    public record ItemError(int index, String productId, String rawValue, String message) {
    }
}
