package com.scrapesentinel.monitors.pipeline;

import com.scrapesentinel.monitors.api.Extractor;
import com.scrapesentinel.monitors.api.Fetcher;
import com.scrapesentinel.monitors.change.ChangeDetector;
import com.scrapesentinel.monitors.diff.DiffEngine;
import com.scrapesentinel.monitors.diff.SnapshotStore;
import com.scrapesentinel.monitors.price.PriceMonitor;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public record ScrapeContext(
        Fetcher fetcher,
        Extractor extractor,
        ChangeDetector changeDetector,
        SnapshotStore snapshotStore,
        DiffEngine diffEngine,
        PriceMonitor priceMonitor,
        Clock clock,
        Duration requestTimeout
) {
    public ScrapeContext {
        Objects.requireNonNull(fetcher, "fetcher is required");
        Objects.requireNonNull(extractor, "extractor is required");
        Objects.requireNonNull(changeDetector, "changeDetector is required");
        Objects.requireNonNull(snapshotStore, "snapshotStore is required");
        Objects.requireNonNull(diffEngine, "diffEngine is required");
        Objects.requireNonNull(priceMonitor, "priceMonitor is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
    }
}
