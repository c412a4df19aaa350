package com.scrapesentinel.service;

import com.scrapesentinel.core.bus.CallbackDispatcher;
import com.scrapesentinel.monitors.change.ChangeDetector;
import com.scrapesentinel.monitors.diff.DiffEngine;
import com.scrapesentinel.monitors.diff.SnapshotStore;
import com.scrapesentinel.monitors.pipeline.ScrapeContext;
import com.scrapesentinel.monitors.pipeline.ScrapePipeline;
import com.scrapesentinel.monitors.price.PriceMonitor;
import com.scrapesentinel.monitors.price.PriceSeries;
import com.scrapesentinel.service.config.ConfigLoader;
import com.scrapesentinel.service.config.JobConfig;
import com.scrapesentinel.service.extract.JsonItemExtractor;
import com.scrapesentinel.service.http.HttpClientFactory;
import com.scrapesentinel.service.http.HttpFetcher;
import com.scrapesentinel.service.http.RobotsAwareFetcher;
import com.scrapesentinel.service.runtime.JobScheduler;
import com.scrapesentinel.service.runtime.SchedulerSettings;
import com.scrapesentinel.service.store.EventCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final Logger EVENT_LOGGER = Logger.getLogger("com.scrapesentinel.events");

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of(args.length > 0 ? args[0] : "config");

        SchedulerSettings settings = ConfigLoader.loadSettings(configDir);
        List<JobConfig> jobConfigs = ConfigLoader.loadJobs(configDir);
        Clock clock = Clock.systemUTC();

        CallbackDispatcher dispatcher = new CallbackDispatcher();
        EventCodec.subscribeAll(dispatcher, event -> EVENT_LOGGER.info(EventCodec.toJsonLine(event)));

        SnapshotStore snapshotStore = new SnapshotStore(clock);
        PriceMonitor priceMonitor = new PriceMonitor(
                new PriceSeries(),
                dispatcher,
                clock,
                settings.defaultThreshold(),
                settings.productThresholds()
        );
        ScrapeContext context = new ScrapeContext(
                new RobotsAwareFetcher(
                        new HttpFetcher(HttpClientFactory.create(Duration.ofSeconds(5))),
                        HttpFetcher.DEFAULT_USER_AGENT,
                        clock
                ),
                new JsonItemExtractor(clock),
                new ChangeDetector(),
                snapshotStore,
                new DiffEngine(snapshotStore),
                priceMonitor,
                clock,
                settings.requestTimeout()
        );

        JobScheduler scheduler = new JobScheduler(new ScrapePipeline(context), dispatcher, clock, settings);
        int scheduled = 0;
        for (JobConfig jobConfig : jobConfigs) {
            if (!jobConfig.isEnabled()) {
                LOGGER.info(() -> "Skipping disabled job " + jobConfig.name());
                continue;
            }
            scheduler.schedule(jobConfig.toDefinition());
            scheduled++;
        }
        LOGGER.info("Starting scheduler with " + scheduled + " job(s) from " + configDir.toAbsolutePath());
        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            LOGGER.info("Scheduler summary at shutdown: " + scheduler.summary());
            LOGGER.info("Snapshot summary at shutdown: " + snapshotStore.summary());
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to load logging.properties: " + e.getMessage());
        }
    }
}
