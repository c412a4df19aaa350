package com.scrapesentinel.core.model;

public enum PriceDirection {
    INCREASE,
    DROP
}
