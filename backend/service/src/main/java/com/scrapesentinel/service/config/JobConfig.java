package com.scrapesentinel.service.config;

import com.scrapesentinel.core.model.JobDefinition;
import com.scrapesentinel.core.model.PriceFields;
import com.scrapesentinel.core.model.ScrapeTarget;
import com.scrapesentinel.core.model.SelectorSpec;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of {@code jobs.json}. {@code cron} takes precedence over {@code intervalSeconds}.
 */
public record JobConfig(
        String name,
        String sourceKey,
        String url,
        Map<String, String> headers,
        SelectorSpec selectors,
        Integer intervalSeconds,
        String cron,
        Integer maxRetries,
        PriceFields price,
        Boolean enabled
) {
    public static final int DEFAULT_INTERVAL_SECONDS = 3600;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public JobConfig {
        Objects.requireNonNull(url, "url is required");
        name = name == null || name.isBlank() ? url : name;
        sourceKey = sourceKey == null || sourceKey.isBlank() ? name : sourceKey;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        selectors = selectors == null ? new SelectorSpec("", Map.of()) : selectors;
        enabled = enabled == null ? Boolean.TRUE : enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration interval() {
        if (cron != null && !cron.isBlank()) {
            return CronIntervals.parse(cron).orElseThrow(() ->
                    new IllegalArgumentException("Unsupported cron expression for job " + name + ": " + cron));
        }
        return Duration.ofSeconds(intervalSeconds == null ? DEFAULT_INTERVAL_SECONDS : intervalSeconds);
    }

    public JobDefinition toDefinition() {
        ScrapeTarget target = new ScrapeTarget(sourceKey, url, headers, selectors, price);
        return new JobDefinition(name, target, interval(), maxRetries == null ? DEFAULT_MAX_RETRIES : maxRetries);
    }
}
