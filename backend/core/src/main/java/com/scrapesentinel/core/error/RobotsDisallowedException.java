package com.scrapesentinel.core.error;

/**
 * The target's robots.txt disallows the path. Retrying will not change that, so the job fails.
 */
public class RobotsDisallowedException extends FetchException {
    public RobotsDisallowedException(String url) {
        super(url, "Disallowed by robots.txt: " + url);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
