package com.scrapesentinel.monitors.pipeline;

import com.scrapesentinel.core.error.ExtractionException;
import com.scrapesentinel.core.error.FetchException;
import com.scrapesentinel.core.error.ScrapeException;
import com.scrapesentinel.core.events.ChangeDetected;
import com.scrapesentinel.core.events.DiffComputed;
import com.scrapesentinel.core.events.Event;
import com.scrapesentinel.core.events.PriceAlertFired;
import com.scrapesentinel.core.model.DiffResult;
import com.scrapesentinel.core.model.ExtractionResult;
import com.scrapesentinel.core.model.JobDefinition;
import com.scrapesentinel.core.model.PriceAlert;
import com.scrapesentinel.core.model.PriceFields;
import com.scrapesentinel.core.model.ScrapeTarget;
import com.scrapesentinel.core.model.Snapshot;
import com.scrapesentinel.monitors.api.JobRunResult;
import com.scrapesentinel.monitors.api.JobRunner;
import com.scrapesentinel.monitors.change.ChangeReport;
import com.scrapesentinel.monitors.price.PriceIngestReport;

import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * One fetch/extract cycle for a job: fetches the target and extracts items. Feeding the result to
 * change detection, the snapshot history and, when configured, price tracking is deferred to
 * {@link JobRunResult#commit()}, and the events those writes produce are returned rather than
 * dispatched.
 */
public class ScrapePipeline implements JobRunner {
    private static final Logger LOGGER = Logger.getLogger(ScrapePipeline.class.getName());

    private final ScrapeContext ctx;

    public ScrapePipeline(ScrapeContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public CompletableFuture<JobRunResult> run(JobDefinition job) {
        ScrapeTarget target = job.target();
        Instant startedAt = ctx.clock().instant();
        Duration timeout = ctx.requestTimeout();

        CompletableFuture<String> fetched;
        try {
            fetched = ctx.fetcher().fetch(target.url(), target.headers(), timeout);
        } catch (RuntimeException e) {
            fetched = CompletableFuture.failedFuture(e);
        }

        return fetched
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((content, error) -> {
                    if (error != null) {
                        throw new CompletionException(asFetchFailure(target.url(), error));
                    }
                    return stage(job, content, startedAt);
                });
    }

    private JobRunResult stage(JobDefinition job, String content, Instant startedAt) {
        ScrapeTarget target = job.target();
        ExtractionResult result = extract(target, content);
        Map<String, Object> stats = new HashMap<>();
        stats.put("items", result.items().size());
        stats.put("durationMillis", Duration.between(startedAt, ctx.clock().instant()).toMillis());
        LOGGER.fine(() -> "Job " + job.name() + " extracted " + result.items().size() + " items from "
                + target.url());
        return new JobRunResult(
                "Extracted " + result.items().size() + " items from " + target.url(),
                stats,
                () -> commit(target, content, result)
        );
    }

    private JobRunResult.Committed commit(ScrapeTarget target, String content, ExtractionResult result) {
        String sourceKey = target.sourceKey();
        Instant now = ctx.clock().instant();
        List<Event> events = new ArrayList<>();
        Map<String, Object> stats = new HashMap<>();

        Optional<ChangeReport> change = ctx.changeDetector().observe(result);
        if (change.isPresent() && !change.get().changes().isEmpty()) {
            ChangeReport report = change.get();
            events.add(new ChangeDetected(
                    now,
                    sourceKey,
                    report.previousFingerprint().hex(),
                    report.currentFingerprint().hex(),
                    report.changes()
            ));
            stats.put("added", report.changes().added().size());
            stats.put("removed", report.changes().removed().size());
        }

        Optional<Snapshot> previous = ctx.snapshotStore().latest(sourceKey);
        String label = result.extractedAt().toString();
        Snapshot current = ctx.snapshotStore().snapshot(sourceKey, label, content, result.extractedAt());
        if (previous.isPresent() && !previous.get().label().equals(label)) {
            DiffResult diff = ctx.diffEngine().diff(previous.get(), current);
            if (diff.hasChanges()) {
                events.add(new DiffComputed(now, diff));
                stats.put("changedLines", diff.changedLines());
            }
        }

        Optional<PriceFields> priceFields = target.priceTracking();
        if (priceFields.isPresent()) {
            PriceIngestReport report = ctx.priceMonitor().recordScrapeResults(
                    result,
                    sourceKey,
                    priceFields.get().priceField(),
                    priceFields.get().nameField()
            );
            for (PriceAlert alert : report.alerts()) {
                events.add(new PriceAlertFired(alert));
            }
            stats.put("pricesTracked", report.tracked());
            stats.put("priceErrors", report.errors().size());
            stats.put("priceAlerts", report.alerts().size());
        }

        LOGGER.fine(() -> "Committed run for " + sourceKey + " with " + events.size() + " events");
        return new JobRunResult.Committed(stats, events);
    }

    private ExtractionResult extract(ScrapeTarget target, String content) {
        try {
            return ctx.extractor().extract(target.sourceKey(), content, target.selectors());
        } catch (ScrapeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtractionException(target.sourceKey(),
                    "Extraction failed for " + target.sourceKey() + ": " + e.getMessage(), e);
        }
    }

    static FetchException asFetchFailure(String url, Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof FetchException fetchFailure) {
            return fetchFailure;
        }
        return new FetchException(url, classifyFailureMessage(url, current), current);
    }

    static String classifyFailureMessage(String url, Throwable error) {
        if (error instanceof TimeoutException) {
            return "Request timed out while fetching " + url;
        }
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        String host = null;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            LOGGER.fine(() -> "Unparsable url " + url + ": " + e.getMessage());
        }
        if ((host != null && host.endsWith(".invalid"))
                || root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("nodename")) {
            return "DNS/unknown host while fetching " + url + ": " + rootText;
        }
        if (lowered.contains("timed out")) {
            return "Request timed out while fetching " + url;
        }
        return "Fetch failure for " + url + ": " + rootText;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
