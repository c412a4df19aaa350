package com.scrapesentinel.core.events;

import com.scrapesentinel.core.model.DiffResult;

import java.time.Instant;

public record DiffComputed(Instant timestamp, DiffResult diff) implements Event {
    @Override
    public String type() {
        return "DiffComputed";
    }
}
