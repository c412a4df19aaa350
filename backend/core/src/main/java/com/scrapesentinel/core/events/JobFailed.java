package com.scrapesentinel.core.events;

import java.time.Instant;

public record JobFailed(
        Instant timestamp,
        String jobId,
        String errorType,
        String message,
        int retryCount,
        boolean terminal,
        Instant nextDue
) implements Event {
    @Override
    public String type() {
        return "JobFailed";
    }
}
