package com.scrapesentinel.monitors.pipeline;

import com.scrapesentinel.core.bus.CallbackDispatcher;
import com.scrapesentinel.core.error.ExtractionException;
import com.scrapesentinel.core.error.FetchException;
import com.scrapesentinel.core.events.ChangeDetected;
import com.scrapesentinel.core.events.DiffComputed;
import com.scrapesentinel.core.events.Event;
import com.scrapesentinel.core.events.PriceAlertFired;
import com.scrapesentinel.core.model.ExtractionResult;
import com.scrapesentinel.core.model.ItemRecord;
import com.scrapesentinel.core.model.JobDefinition;
import com.scrapesentinel.core.model.PriceFields;
import com.scrapesentinel.core.model.ScrapeTarget;
import com.scrapesentinel.core.model.SelectorSpec;
import com.scrapesentinel.monitors.api.Extractor;
import com.scrapesentinel.monitors.api.Fetcher;
import com.scrapesentinel.monitors.api.JobRunResult;
import com.scrapesentinel.monitors.change.ChangeDetector;
import com.scrapesentinel.monitors.diff.DiffEngine;
import com.scrapesentinel.monitors.diff.SnapshotStore;
import com.scrapesentinel.monitors.price.PriceMonitor;
import com.scrapesentinel.monitors.support.EventCapture;
import com.scrapesentinel.monitors.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScrapePipelineTest {
    private static final String URL = "https://shop.example/catalog";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final CallbackDispatcher dispatcher = new CallbackDispatcher((event, ex) -> {
        throw new AssertionError("Unexpected handler error", ex);
    });
    private final EventCapture capture = new EventCapture(dispatcher);
    private final SnapshotStore snapshots = new SnapshotStore(clock);
    private final PriceMonitor priceMonitor = new PriceMonitor(dispatcher, clock);
    private final ChangeDetector changeDetector = new ChangeDetector();
    private final AtomicReference<Fetcher> fetcher = new AtomicReference<>();
    private final ScrapePipeline pipeline = new ScrapePipeline(new ScrapeContext(
            (url, headers, timeout) -> fetcher.get().fetch(url, headers, timeout),
            new LineExtractor(),
            changeDetector,
            snapshots,
            new DiffEngine(snapshots),
            priceMonitor,
            clock,
            Duration.ofMillis(200)
    ));

    @Test
    void firstRunEstablishesBaselineWithoutEvents() {
        serve("widget=10.00\ngadget=20.00\n");

        JobRunResult result = pipeline.run(job(true)).join();
        JobRunResult.Committed committed = result.commit();

        assertTrue(committed.events().isEmpty());
        assertEquals(2, committed.stats().get("items"));
        assertEquals(2, committed.stats().get("pricesTracked"));
        assertEquals("Extracted 2 items from " + URL, result.message());
        assertEquals(1, snapshots.history("catalog").size());
    }

    @Test
    void changedContentProducesChangeDiffAndPriceEventsUndispatched() {
        serve("widget=10.00\ngadget=20.00\n");
        pipeline.run(job(true)).join().commit();
        clock.advance(Duration.ofMinutes(5));
        serve("widget=12.00\ngadget=20.00\n");

        List<Event> events = pipeline.run(job(true)).join().commit().events();

        assertEquals(3, events.size());
        ChangeDetected change = assertInstanceOf(ChangeDetected.class, events.get(0));
        DiffComputed diff = assertInstanceOf(DiffComputed.class, events.get(1));
        PriceAlertFired alert = assertInstanceOf(PriceAlertFired.class, events.get(2));
        assertEquals(1, change.changes().added().size());
        assertEquals(1, change.changes().removed().size());
        assertEquals(2, diff.diff().changedLines());
        assertEquals("widget", alert.alert().productId());
        assertTrue(capture.all().isEmpty());
        assertEquals(2, snapshots.history("catalog").size());
    }

    @Test
    void unchangedContentProducesNoEvents() {
        serve("widget=10.00\n");
        pipeline.run(job(false)).join().commit();
        clock.advance(Duration.ofMinutes(5));

        JobRunResult result = pipeline.run(job(false)).join();

        assertTrue(result.commit().events().isEmpty());
        assertTrue(priceMonitor.products().isEmpty());
    }

    @Test
    void storesAreUntouchedUntilTheRunIsCommitted() {
        serve("widget=10.00\n");

        JobRunResult result = pipeline.run(job(true)).join();

        assertEquals(1, result.stats().get("items"));
        assertTrue(snapshots.history("catalog").isEmpty());
        assertTrue(priceMonitor.products().isEmpty());
        assertTrue(changeDetector.lastFingerprint("catalog").isEmpty());

        result.commit();

        assertEquals(1, snapshots.history("catalog").size());
        assertEquals(List.of("widget"), List.copyOf(priceMonitor.products()));
        assertTrue(changeDetector.lastFingerprint("catalog").isPresent());
    }

    @Test
    void failedFetchSurfacesAsFetchException() {
        fetcher.set((url, headers, timeout) -> CompletableFuture.failedFuture(new IOException("connection reset")));

        CompletionException error = assertThrows(CompletionException.class, () -> pipeline.run(job(false)).join());

        FetchException cause = assertInstanceOf(FetchException.class, error.getCause());
        assertTrue(cause.retryable());
        assertEquals("Fetch failure for " + URL + ": connection reset", cause.getMessage());
    }

    @Test
    void fetcherThrowingImmediatelyIsStillAFailedFuture() {
        fetcher.set((url, headers, timeout) -> {
            throw new IllegalStateException("client closed");
        });

        CompletableFuture<JobRunResult> future = pipeline.run(job(false));

        CompletionException error = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(FetchException.class, error.getCause());
    }

    @Test
    void hangingFetchTimesOut() {
        fetcher.set((url, headers, timeout) -> new CompletableFuture<>());

        CompletionException error = assertThrows(CompletionException.class, () -> pipeline.run(job(false)).join());

        FetchException cause = assertInstanceOf(FetchException.class, error.getCause());
        assertInstanceOf(TimeoutException.class, cause.getCause());
        assertEquals("Request timed out while fetching " + URL, cause.getMessage());
    }

    @Test
    void extractorFailureIsWrappedAsExtractionException() {
        serve("no separator here\n");

        CompletionException error = assertThrows(CompletionException.class, () -> pipeline.run(job(false)).join());

        assertInstanceOf(ExtractionException.class, error.getCause());
    }

    @Test
    void classifiesDnsFailures() {
        String message = ScrapePipeline.classifyFailureMessage(URL, new UnknownHostException("shop.example"));

        assertEquals("DNS/unknown host while fetching " + URL + ": shop.example", message);
    }

    private void serve(String content) {
        fetcher.set((url, headers, timeout) -> CompletableFuture.completedFuture(content));
    }

    private static JobDefinition job(boolean trackPrices) {
        ScrapeTarget target = new ScrapeTarget(
                "catalog",
                URL,
                Map.of("Accept", "text/plain"),
                new SelectorSpec("line", Map.of("name", "0", "price", "1")),
                trackPrices ? new PriceFields("name", "price") : null
        );
        return new JobDefinition("catalog-job", target, Duration.ofMinutes(5), 3);
    }

    /**
     * Reads {@code name=price} lines; anything else is a malformed page.
     */
    private final class LineExtractor implements Extractor {
        @Override
        public ExtractionResult extract(String sourceKey, String content, SelectorSpec selectors) {
            List<ItemRecord> items = new ArrayList<>();
            for (String line : content.split("\n")) {
                String[] parts = line.split("=", 2);
                if (parts.length != 2) {
                    throw new IllegalArgumentException("Malformed line: " + line);
                }
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("name", parts[0]);
                fields.put("price", parts[1]);
                items.add(ItemRecord.of(fields));
            }
            return new ExtractionResult(sourceKey, items, clock.instant());
        }
    }
}
