package com.scrapesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public record ChangeSet(List<ItemRecord> added, List<ItemRecord> removed) {
    public ChangeSet {
        added = List.copyOf(added);
        removed = List.copyOf(removed);
    }

    public static ChangeSet empty() {
        return new ChangeSet(List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
