package com.scrapesentinel.core.events;

import com.scrapesentinel.core.model.PriceAlert;

import java.time.Instant;

public record PriceAlertFired(Instant timestamp, PriceAlert alert) implements Event {
    public PriceAlertFired(PriceAlert alert) {
        this(alert.timestamp(), alert);
    }

    @Override
    public String type() {
        return "PriceAlertFired";
    }
}
