package com.scrapesentinel.monitors.api;

import com.scrapesentinel.core.model.JobDefinition;

import java.util.concurrent.CompletableFuture;

public interface JobRunner {
    CompletableFuture<JobRunResult> run(JobDefinition job);
}
