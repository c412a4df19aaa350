package com.scrapesentinel.core.model;

import java.time.Instant;

public record JobHistoryEntry(Instant timestamp, boolean success, String message) {
}
