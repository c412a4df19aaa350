package com.scrapesentinel.monitors.diff;

import com.scrapesentinel.core.error.NotFoundException;
import com.scrapesentinel.core.model.Snapshot;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Labeled content snapshots per source key, kept in insertion order and never evicted.
 * Each source key has its own lock, so writers to different sources do not contend.
 */
public class SnapshotStore {
    private final Map<String, SourceSnapshots> sources = new ConcurrentHashMap<>();
    private final Clock clock;

    public SnapshotStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates the snapshot, or replaces content and timestamp of an existing label in place.
     */
    public Snapshot snapshot(String sourceKey, String label, String content) {
        return snapshot(sourceKey, label, content, clock.instant());
    }

    public Snapshot snapshot(String sourceKey, String label, String content, Instant timestamp) {
        Snapshot snapshot = new Snapshot(label, sourceKey, content, timestamp);
        SourceSnapshots source = sources.computeIfAbsent(sourceKey, ignored -> new SourceSnapshots());
        source.locked(() -> source.byLabel.put(label, snapshot));
        return snapshot;
    }

    public Optional<Snapshot> find(String sourceKey, String label) {
        SourceSnapshots source = sources.get(sourceKey);
        if (source == null) {
            return Optional.empty();
        }
        return source.locked(() -> Optional.ofNullable(source.byLabel.get(label)));
    }

    public Snapshot get(String sourceKey, String label) {
        return find(sourceKey, label).orElseThrow(() ->
                new NotFoundException("No snapshot labeled '" + label + "' for " + sourceKey));
    }

    public List<Snapshot> history(String sourceKey) {
        SourceSnapshots source = sources.get(sourceKey);
        if (source == null) {
            return List.of();
        }
        return source.locked(() -> List.copyOf(source.byLabel.values()));
    }

    public Optional<Snapshot> latest(String sourceKey) {
        List<Snapshot> history = history(sourceKey);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    public Set<String> sourceKeys() {
        return new TreeSet<>(sources.keySet());
    }

    public SnapshotSummary summary() {
        int totalSnapshots = 0;
        int sourcesWithChanges = 0;
        for (String sourceKey : sourceKeys()) {
            List<Snapshot> history = history(sourceKey);
            totalSnapshots += history.size();
            Set<String> contents = new HashSet<>();
            for (Snapshot snapshot : history) {
                contents.add(snapshot.content());
            }
            if (contents.size() > 1) {
                sourcesWithChanges++;
            }
        }
        return new SnapshotSummary(sources.size(), totalSnapshots, sourcesWithChanges);
    }

    private static final class SourceSnapshots {
        private final ReentrantLock lock = new ReentrantLock();
        private final LinkedHashMap<String, Snapshot> byLabel = new LinkedHashMap<>();

        private <T> T locked(Supplier<T> action) {
            lock.lock();
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        }
    }
}
