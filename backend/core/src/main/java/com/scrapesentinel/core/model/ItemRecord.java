package com.scrapesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public record ItemRecord(Map<String, FieldValue> fields) {
    public ItemRecord {
        Objects.requireNonNull(fields, "fields is required");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ItemRecord of(Map<String, ?> values) {
        Map<String, FieldValue> converted = new LinkedHashMap<>();
        values.forEach((name, value) -> converted.put(name, FieldValue.of(value)));
        return new ItemRecord(converted);
    }

    public static ItemRecord of(String name, Object value) {
        return of(Map.of(name, value));
    }

    public Optional<FieldValue> get(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    @JsonValue
    public Map<String, Object> plainValues() {
        Map<String, Object> plain = new LinkedHashMap<>();
        fields.forEach((name, value) -> plain.put(name, value.raw()));
        return plain;
    }
}
