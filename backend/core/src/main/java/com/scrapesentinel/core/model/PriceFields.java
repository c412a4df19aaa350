package com.scrapesentinel.core.model;

import java.util.Objects;

public record PriceFields(String nameField, String priceField) {
    public PriceFields {
        Objects.requireNonNull(nameField, "nameField is required");
        Objects.requireNonNull(priceField, "priceField is required");
    }
}
