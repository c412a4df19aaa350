package com.scrapesentinel.monitors.diff;

public record SnapshotSummary(int sourcesTracked, int totalSnapshots, int sourcesWithChanges) {
}
