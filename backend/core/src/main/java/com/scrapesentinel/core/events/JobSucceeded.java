package com.scrapesentinel.core.events;

import java.time.Instant;
import java.util.Map;

public record JobSucceeded(
        Instant timestamp,
        String jobId,
        String message,
        long durationMillis,
        Map<String, Object> stats
) implements Event {
    @Override
    public String type() {
        return "JobSucceeded";
    }
}
