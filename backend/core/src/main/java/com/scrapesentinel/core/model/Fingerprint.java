package com.scrapesentinel.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * SHA-256 digest in lowercase hex.
 */
public record Fingerprint(String hex) implements Comparable<Fingerprint> {
    private static final Pattern HEX_256 = Pattern.compile("[0-9a-f]{64}");

    public Fingerprint {
        Objects.requireNonNull(hex, "hex is required");
        if (!HEX_256.matcher(hex).matches()) {
            throw new IllegalArgumentException("Fingerprint must be 64 lowercase hex characters: " + hex);
        }
    }

    @Override
    public int compareTo(Fingerprint other) {
        return hex.compareTo(other.hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
