package com.scrapesentinel.monitors.change;

import com.scrapesentinel.core.model.Fingerprint;
import com.scrapesentinel.core.model.ItemRecord;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Item fingerprints of one extraction run, each mapped to the first item that produced it.
 */
public final class FingerprintIndex {
    private final Map<Fingerprint, ItemRecord> items;
    private final Fingerprint setFingerprint;

    FingerprintIndex(Map<Fingerprint, ItemRecord> items) {
        this.items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
        this.setFingerprint = Hasher.combine(this.items.keySet());
    }

    public static FingerprintIndex empty() {
        return new FingerprintIndex(Map.of());
    }

    public Set<Fingerprint> fingerprints() {
        return items.keySet();
    }

    public Collection<ItemRecord> items() {
        return items.values();
    }

    public boolean contains(Fingerprint fingerprint) {
        return items.containsKey(fingerprint);
    }

    public ItemRecord item(Fingerprint fingerprint) {
        return items.get(fingerprint);
    }

    public int size() {
        return items.size();
    }

    public Fingerprint setFingerprint() {
        return setFingerprint;
    }
}
