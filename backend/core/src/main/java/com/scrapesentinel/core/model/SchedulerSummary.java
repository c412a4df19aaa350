package com.scrapesentinel.core.model;

/**
 * Totals over every job the scheduler knows. {@code activeJobs} counts jobs that are idle or running.
 */
public record SchedulerSummary(
        boolean running,
        int totalJobs,
        int activeJobs,
        int runningJobs,
        int failedJobs,
        long totalRuns,
        long totalErrors
) {
}
