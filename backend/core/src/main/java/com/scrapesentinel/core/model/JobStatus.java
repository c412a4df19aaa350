package com.scrapesentinel.core.model;

import java.time.Instant;

public record JobStatus(
        String id,
        JobState state,
        Instant nextDue,
        String lastResult,
        int retryCount,
        int maxRetries,
        boolean overdue,
        int runCount,
        int errorCount,
        String lastError,
        Instant lastRunAt
) {
}
