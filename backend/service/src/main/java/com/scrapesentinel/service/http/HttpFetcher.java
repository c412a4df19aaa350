package com.scrapesentinel.service.http;

import com.scrapesentinel.core.error.FetchException;
import com.scrapesentinel.monitors.api.Fetcher;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * {@link Fetcher} over {@link HttpClient}. Any status of 400 or above fails the fetch with a
 * {@link FetchException} carrying the status.
 */
public class HttpFetcher implements Fetcher {
    public static final String DEFAULT_USER_AGENT = "scrape-sentinel/0.1";

    private static final Logger LOGGER = Logger.getLogger(HttpFetcher.class.getName());

    private final HttpClient client;
    private final String userAgent;

    public HttpFetcher(HttpClient client) {
        this(client, DEFAULT_USER_AGENT);
    }

    public HttpFetcher(HttpClient client, String userAgent) {
        this.client = client;
        this.userAgent = userAgent;
    }

    @Override
    public CompletableFuture<String> fetch(String url, Map<String, String> headers, Duration timeout) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .GET();
            headers.forEach(builder::setHeader);
            request = builder.build();
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new FetchException(url, "Invalid request for " + url + ": " + e.getMessage(), e));
        }

        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> {
                    int status = response.statusCode();
                    LOGGER.fine(() -> "GET " + url + " -> " + status);
                    if (status >= 400) {
                        throw new FetchException(url, status, "HTTP " + status + " from " + url, null);
                    }
                    return response.body();
                });
    }
}
