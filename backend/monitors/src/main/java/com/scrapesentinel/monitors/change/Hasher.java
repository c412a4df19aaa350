package com.scrapesentinel.monitors.change;

import com.scrapesentinel.core.model.FieldValue;
import com.scrapesentinel.core.model.Fingerprint;
import com.scrapesentinel.core.model.ItemRecord;
import com.scrapesentinel.core.util.HashingUtils;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Content fingerprints for extracted items.
 *
 * <p>An item is canonicalized as its fields sorted by name, each written as length-prefixed
 * {@code name}, {@code tag} and {@code canonical value}, then digested with SHA-256. A set of
 * items hashes the sorted distinct item fingerprints, so extraction order and exact duplicates
 * never change the result.
 */
public final class Hasher {
    private Hasher() {
    }

    public static Fingerprint fingerprint(ItemRecord item) {
        MessageDigest digest = HashingUtils.newSha256();
        List<String> names = new ArrayList<>(item.fields().keySet());
        names.sort(null);
        for (String name : names) {
            FieldValue value = item.fields().get(name);
            update(digest, name);
            update(digest, value.tag());
            update(digest, value.canonical());
        }
        return new Fingerprint(HashingUtils.hex(digest.digest()));
    }

    public static Fingerprint fingerprint(Collection<ItemRecord> items) {
        return combine(index(items).fingerprints());
    }

    public static FingerprintIndex index(Collection<ItemRecord> items) {
        Map<Fingerprint, ItemRecord> byFingerprint = new LinkedHashMap<>();
        for (ItemRecord item : items) {
            byFingerprint.putIfAbsent(fingerprint(item), item);
        }
        return new FingerprintIndex(byFingerprint);
    }

    static Fingerprint combine(Collection<Fingerprint> fingerprints) {
        MessageDigest digest = HashingUtils.newSha256();
        for (Fingerprint fingerprint : new TreeSet<>(fingerprints)) {
            digest.update(fingerprint.hex().getBytes(StandardCharsets.US_ASCII));
        }
        return new Fingerprint(HashingUtils.hex(digest.digest()));
    }

    private static void update(MessageDigest digest, String part) {
        byte[] bytes = part.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }
}
