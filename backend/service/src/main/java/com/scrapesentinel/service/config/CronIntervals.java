package com.scrapesentinel.service.config;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps the few cron shapes the job files use onto fixed intervals: a step minute field
 * ({@code *&#47;N * * * *}, every N minutes), {@code 0 * * * *} (hourly) and {@code 0 0 * * *} (daily).
 * Anything else is unsupported.
 */
public final class CronIntervals {
    private CronIntervals() {
    }

    public static Optional<Duration> parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.empty();
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            return Optional.empty();
        }
        String minute = parts[0];
        String hour = parts[1];
        String day = parts[2];
        if (!"*".equals(day)) {
            return Optional.empty();
        }

        if (minute.startsWith("*/") && "*".equals(hour)) {
            try {
                int minutes = Integer.parseInt(minute.substring(2));
                return minutes > 0 ? Optional.of(Duration.ofMinutes(minutes)) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if ("0".equals(minute) && "*".equals(hour)) {
            return Optional.of(Duration.ofHours(1));
        }
        if ("0".equals(minute) && "0".equals(hour)) {
            return Optional.of(Duration.ofDays(1));
        }
        return Optional.empty();
    }
}
