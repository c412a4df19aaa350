package com.scrapesentinel.monitors.change;

import com.scrapesentinel.core.model.ChangeSet;
import com.scrapesentinel.core.model.Fingerprint;

public record ChangeReport(
        String sourceKey,
        Fingerprint previousFingerprint,
        Fingerprint currentFingerprint,
        ChangeSet changes
) {
    public boolean changed() {
        return !previousFingerprint.equals(currentFingerprint);
    }
}
