package com.scrapesentinel.service.runtime;

import com.scrapesentinel.core.bus.CallbackDispatcher;
import com.scrapesentinel.core.events.ChangeDetected;
import com.scrapesentinel.core.events.DiffComputed;
import com.scrapesentinel.core.events.Event;
import com.scrapesentinel.core.events.JobFailed;
import com.scrapesentinel.core.events.JobSucceeded;
import com.scrapesentinel.core.events.PriceAlertFired;
import com.scrapesentinel.core.model.JobState;
import com.scrapesentinel.core.model.PriceFields;
import com.scrapesentinel.core.model.SelectorSpec;
import com.scrapesentinel.monitors.change.ChangeDetector;
import com.scrapesentinel.monitors.diff.DiffEngine;
import com.scrapesentinel.monitors.diff.SnapshotStore;
import com.scrapesentinel.monitors.pipeline.ScrapeContext;
import com.scrapesentinel.monitors.pipeline.ScrapePipeline;
import com.scrapesentinel.monitors.price.PriceMonitor;
import com.scrapesentinel.service.config.JobConfig;
import com.scrapesentinel.service.extract.JsonItemExtractor;
import com.scrapesentinel.service.http.HttpClientFactory;
import com.scrapesentinel.service.http.HttpFetcher;
import com.scrapesentinel.service.support.MutableClock;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScrapeFlowIntegrationTest {
    private static final String FIRST = """
            {"products":[
            {"title":"Widget","price":10.00},
            {"title":"Gadget","price":20.00}
            ]}
            """;
    private static final String SECOND = """
            {"products":[
            {"title":"Widget","price":12.00},
            {"title":"Gadget","price":20.00}
            ]}
            """;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final AtomicReference<String> page = new AtomicReference<>(FIRST);
    private final AtomicInteger status = new AtomicInteger(200);
    private final List<Event> delivered = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
    private HttpServer server;
    private JobScheduler scheduler;
    private SnapshotStore snapshots;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/products", exchange -> {
            byte[] body = page.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();

        CallbackDispatcher dispatcher = new CallbackDispatcher((event, ex) -> {
            throw new AssertionError("Unexpected handler error", ex);
        });
        dispatcher.register(ChangeDetected.class, delivered::add);
        dispatcher.register(DiffComputed.class, delivered::add);
        dispatcher.register(PriceAlertFired.class, delivered::add);
        dispatcher.register(JobSucceeded.class, delivered::add);
        dispatcher.register(JobFailed.class, delivered::add);

        SchedulerSettings settings = SchedulerSettings.defaults();
        snapshots = new SnapshotStore(clock);
        ScrapeContext context = new ScrapeContext(
                new HttpFetcher(HttpClientFactory.create(Duration.ofSeconds(2))),
                new JsonItemExtractor(clock),
                new ChangeDetector(),
                snapshots,
                new DiffEngine(snapshots),
                new PriceMonitor(dispatcher, clock),
                clock,
                Duration.ofSeconds(2)
        );
        scheduler = new JobScheduler(new ScrapePipeline(context), dispatcher, clock, settings, timer, Runnable::run, Runnable::run);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
        timer.shutdownNow();
        server.stop(0);
    }

    @Test
    void priceChangeFlowsFromFetchToCallbacks() throws InterruptedException {
        JobConfig config = new JobConfig(
                "catalog",
                "shop",
                "http://127.0.0.1:" + server.getAddress().getPort() + "/api/products",
                Map.of("Accept", "application/json"),
                new SelectorSpec("/products", Map.of("name", "/title", "price", "/price")),
                60,
                null,
                3,
                new PriceFields("name", "price"),
                true
        );
        scheduler.schedule(config.toDefinition());

        runUntilCompleted(1);
        assertEquals(1, delivered.size());
        assertInstanceOf(JobSucceeded.class, delivered.get(0));

        page.set(SECOND);
        clock.advance(Duration.ofMinutes(1));
        runUntilCompleted(2);

        assertEquals(5, delivered.size());
        ChangeDetected change = assertInstanceOf(ChangeDetected.class, delivered.get(1));
        DiffComputed diff = assertInstanceOf(DiffComputed.class, delivered.get(2));
        PriceAlertFired alert = assertInstanceOf(PriceAlertFired.class, delivered.get(3));
        JobSucceeded succeeded = assertInstanceOf(JobSucceeded.class, delivered.get(4));
        assertEquals("shop", change.sourceKey());
        assertEquals(1, diff.diff().addedLines());
        assertEquals(1, diff.diff().removedLines());
        assertEquals("Widget", alert.alert().productId());
        assertEquals(0, alert.alert().pctChange().compareTo(new BigDecimal("20")));
        assertEquals(1, succeeded.stats().get("priceAlerts"));
        assertEquals(2, snapshots.history("shop").size());
    }

    @Test
    void serverErrorsConsumeRetriesThenFailTheJob() throws InterruptedException {
        status.set(503);
        JobConfig config = new JobConfig(
                "flaky",
                null,
                "http://127.0.0.1:" + server.getAddress().getPort() + "/api/products",
                null,
                new SelectorSpec("/products", Map.of()),
                60,
                null,
                2,
                null,
                null
        );
        scheduler.schedule(config.toDefinition());

        runUntilCompleted(1);
        clock.advance(SchedulerSettings.DEFAULT_BACKOFF_BASE);
        runUntilCompleted(2);

        assertEquals(JobState.FAILED, scheduler.getStatus("flaky").orElseThrow().state());
        assertEquals(2, delivered.size());
        JobFailed last = assertInstanceOf(JobFailed.class, delivered.get(1));
        assertTrue(last.terminal());
        assertTrue(last.message().contains("HTTP 503"));
    }

    private void runUntilCompleted(int runs) throws InterruptedException {
        for (int i = 0; i < 200; i++) {
            scheduler.tick();
            if (scheduler.getStatus().get(0).runCount() >= runs) {
                return;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("Job did not complete " + runs + " run(s)");
    }
}
