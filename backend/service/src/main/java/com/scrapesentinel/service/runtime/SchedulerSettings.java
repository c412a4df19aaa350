package com.scrapesentinel.service.runtime;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Tuning for the scheduler loop and the scrape pipeline. Omitted values fall back to the defaults.
 */
public record SchedulerSettings(
        Duration tickInterval,
        Integer maxConcurrency,
        Duration backoffBase,
        Duration backoffCap,
        Duration executionTimeout,
        Duration requestTimeout,
        BigDecimal defaultThreshold,
        Map<String, BigDecimal> productThresholds
) {
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(5);
    public static final Duration DEFAULT_BACKOFF_CAP = Duration.ofMinutes(10);
    public static final Duration DEFAULT_EXECUTION_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final BigDecimal DEFAULT_THRESHOLD = new BigDecimal("5.0");

    public SchedulerSettings {
        tickInterval = positive(tickInterval, DEFAULT_TICK_INTERVAL, "tickInterval");
        maxConcurrency = maxConcurrency == null ? DEFAULT_MAX_CONCURRENCY : maxConcurrency;
        backoffBase = positive(backoffBase, DEFAULT_BACKOFF_BASE, "backoffBase");
        backoffCap = positive(backoffCap, DEFAULT_BACKOFF_CAP, "backoffCap");
        executionTimeout = positive(executionTimeout, DEFAULT_EXECUTION_TIMEOUT, "executionTimeout");
        requestTimeout = positive(requestTimeout, DEFAULT_REQUEST_TIMEOUT, "requestTimeout");
        defaultThreshold = defaultThreshold == null ? DEFAULT_THRESHOLD : defaultThreshold;
        productThresholds = productThresholds == null ? Map.of() : Map.copyOf(productThresholds);
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        if (backoffCap.compareTo(backoffBase) < 0) {
            throw new IllegalArgumentException("backoffCap must not be shorter than backoffBase");
        }
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(null, null, null, null, null, null, null, null);
    }

    private static Duration positive(Duration value, Duration fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
