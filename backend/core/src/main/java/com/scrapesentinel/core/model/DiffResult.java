package com.scrapesentinel.core.model;

public record DiffResult(
        String sourceKey,
        String fromLabel,
        String toLabel,
        String unifiedDiff,
        int addedLines,
        int removedLines,
        double similarity
) {
    public int changedLines() {
        return addedLines + removedLines;
    }

    public boolean hasChanges() {
        return changedLines() > 0;
    }
}
