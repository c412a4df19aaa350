package com.scrapesentinel.service.http;

import com.scrapesentinel.core.error.RobotsDisallowedException;
import com.scrapesentinel.monitors.api.Fetcher;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Consults the origin's robots.txt before handing a fetch to the wrapped {@link Fetcher}. Rules are
 * cached per origin. A robots.txt that cannot be fetched, including a 404, allows everything.
 */
public class RobotsAwareFetcher implements Fetcher {
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(1);

    private static final Logger LOGGER = Logger.getLogger(RobotsAwareFetcher.class.getName());

    private final Fetcher delegate;
    private final String agentToken;
    private final Clock clock;
    private final Duration cacheTtl;
    private final Map<String, CachedRules> cache = new ConcurrentHashMap<>();

    public RobotsAwareFetcher(Fetcher delegate, String userAgent, Clock clock) {
        this(delegate, userAgent, clock, DEFAULT_CACHE_TTL);
    }

    public RobotsAwareFetcher(Fetcher delegate, String userAgent, Clock clock, Duration cacheTtl) {
        this.delegate = delegate;
        this.agentToken = agentToken(userAgent);
        this.clock = clock;
        this.cacheTtl = cacheTtl;
    }

    @Override
    public CompletableFuture<String> fetch(String url, Map<String, String> headers, Duration timeout) {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return delegate.fetch(url, headers, timeout);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            return delegate.fetch(url, headers, timeout);
        }
        String origin = uri.getScheme() + "://" + uri.getRawAuthority();
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();

        return rules(origin, timeout).thenCompose(disallowed -> {
            if (!isAllowed(path, disallowed)) {
                LOGGER.info(() -> "Skipping " + url + ": disallowed by " + origin + "/robots.txt");
                return CompletableFuture.failedFuture(new RobotsDisallowedException(url));
            }
            return delegate.fetch(url, headers, timeout);
        });
    }

    static List<String> parseDisallowed(String robotsText, String agentToken) {
        List<String> disallowed = new ArrayList<>();
        boolean applies = false;
        for (String rawLine : robotsText.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).strip().toLowerCase(Locale.ROOT);
            String value = line.substring(colon + 1).strip();
            if (key.equals("user-agent")) {
                String agent = value.toLowerCase(Locale.ROOT);
                applies = agent.equals("*") || agent.contains(agentToken);
            } else if (applies && key.equals("disallow") && !value.isEmpty()) {
                disallowed.add(value);
            }
        }
        return List.copyOf(disallowed);
    }

    static boolean isAllowed(String path, List<String> disallowed) {
        for (String prefix : disallowed) {
            if (prefix.equals("/") || path.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    private CompletableFuture<List<String>> rules(String origin, Duration timeout) {
        Instant now = clock.instant();
        CachedRules cached = cache.get(origin);
        if (cached != null && now.isBefore(cached.fetchedAt().plus(cacheTtl))) {
            return CompletableFuture.completedFuture(cached.disallowed());
        }

        String robotsUrl = origin + "/robots.txt";
        CompletableFuture<String> fetched;
        try {
            fetched = delegate.fetch(robotsUrl, Map.of(), timeout);
        } catch (RuntimeException e) {
            fetched = CompletableFuture.failedFuture(e);
        }
        return fetched.handle((body, error) -> {
            List<String> disallowed;
            if (error != null) {
                LOGGER.fine(() -> "No usable " + robotsUrl + ", allowing all paths: " + error.getMessage());
                disallowed = List.of();
            } else {
                disallowed = parseDisallowed(body, agentToken);
            }
            cache.put(origin, new CachedRules(disallowed, now));
            return disallowed;
        });
    }

    private static String agentToken(String userAgent) {
        String product = userAgent.strip();
        int slash = product.indexOf('/');
        if (slash > 0) {
            product = product.substring(0, slash);
        }
        return product.toLowerCase(Locale.ROOT);
    }

    private record CachedRules(List<String> disallowed, Instant fetchedAt) {
    }
}
