package com.scrapesentinel.core.model;

import java.util.Map;

/**
 * Opaque to the pipeline: only the configured {@code Extractor} interprets the selectors.
 */
public record SelectorSpec(String itemSelector, Map<String, String> fields) {
    public SelectorSpec {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
