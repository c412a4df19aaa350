package com.scrapesentinel.core.events;

import com.scrapesentinel.core.model.ChangeSet;

import java.time.Instant;

public record ChangeDetected(
        Instant timestamp,
        String sourceKey,
        String previousFingerprint,
        String currentFingerprint,
        ChangeSet changes
) implements Event {
    @Override
    public String type() {
        return "ChangeDetected";
    }
}
