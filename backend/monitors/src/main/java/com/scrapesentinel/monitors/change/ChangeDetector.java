package com.scrapesentinel.monitors.change;

import com.scrapesentinel.core.model.ChangeSet;
import com.scrapesentinel.core.model.ExtractionResult;
import com.scrapesentinel.core.model.Fingerprint;
import com.scrapesentinel.core.model.ItemRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Set difference between two extraction runs, keyed by item fingerprint. An item whose field
 * values changed shows up as one removal plus one addition.
 */
public class ChangeDetector {
    private static final Logger LOGGER = Logger.getLogger(ChangeDetector.class.getName());

    private final Map<String, FingerprintIndex> lastSeen = new ConcurrentHashMap<>();

    public static ChangeSet detectChanges(FingerprintIndex previous, FingerprintIndex current) {
        List<ItemRecord> added = new ArrayList<>();
        for (Fingerprint fingerprint : current.fingerprints()) {
            if (!previous.contains(fingerprint)) {
                added.add(current.item(fingerprint));
            }
        }
        List<ItemRecord> removed = new ArrayList<>();
        for (Fingerprint fingerprint : previous.fingerprints()) {
            if (!current.contains(fingerprint)) {
                removed.add(previous.item(fingerprint));
            }
        }
        return new ChangeSet(added, removed);
    }

    public static ChangeSet detectChanges(Collection<ItemRecord> previous, Collection<ItemRecord> current) {
        return detectChanges(Hasher.index(previous), Hasher.index(current));
    }

    /**
     * Compares {@code result} with the last run seen for the same source and remembers it for the
     * next call. The first run of a source only sets the baseline and reports nothing.
     */
    public Optional<ChangeReport> observe(ExtractionResult result) {
        FingerprintIndex current = Hasher.index(result.items());
        AtomicReference<FingerprintIndex> previous = new AtomicReference<>();
        lastSeen.compute(result.sourceKey(), (key, prior) -> {
            previous.set(prior);
            return current;
        });

        FingerprintIndex prior = previous.get();
        if (prior == null) {
            LOGGER.fine(() -> "Baseline recorded for " + result.sourceKey() + " with " + current.size() + " items");
            return Optional.empty();
        }
        ChangeSet changes = detectChanges(prior, current);
        return Optional.of(new ChangeReport(
                result.sourceKey(),
                prior.setFingerprint(),
                current.setFingerprint(),
                changes
        ));
    }

    public Optional<Fingerprint> lastFingerprint(String sourceKey) {
        return Optional.ofNullable(lastSeen.get(sourceKey)).map(FingerprintIndex::setFingerprint);
    }

    public void forget(String sourceKey) {
        lastSeen.remove(sourceKey);
    }
}
