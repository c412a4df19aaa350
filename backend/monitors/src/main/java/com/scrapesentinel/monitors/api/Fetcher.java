package com.scrapesentinel.monitors.api;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface Fetcher {
    /**
     * Retrieves raw content for {@code url} within {@code timeout}. Transport failures may surface as
     * their own exception types; the pipeline turns them into a
     * {@link com.scrapesentinel.core.error.FetchException}.
     */
    CompletableFuture<String> fetch(String url, Map<String, String> headers, Duration timeout);
}
