package com.scrapesentinel.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Typed value of a single extracted field. The tag keeps {@code "1"} (text) and {@code 1.0}
 * (number) apart when items are canonicalized for hashing.
 */
public sealed interface FieldValue permits FieldValue.Text, FieldValue.Decimal, FieldValue.Bool, FieldValue.DateTime {
    String tag();

    String canonical();

    Object raw();

    static FieldValue of(Object value) {
        Objects.requireNonNull(value, "value is required");
        if (value instanceof FieldValue fieldValue) {
            return fieldValue;
        }
        if (value instanceof String text) {
            return new Text(text);
        }
        if (value instanceof BigDecimal decimal) {
            return new Decimal(decimal);
        }
        if (value instanceof Number number) {
            return new Decimal(new BigDecimal(number.toString()));
        }
        if (value instanceof Boolean bool) {
            return new Bool(bool);
        }
        if (value instanceof Instant instant) {
            return new DateTime(instant);
        }
        throw new IllegalArgumentException("Unsupported field value type: " + value.getClass().getName());
    }

    record Text(String value) implements FieldValue {
        public Text {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public String tag() {
            return "s";
        }

        @Override
        public String canonical() {
            return value;
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record Decimal(BigDecimal value) implements FieldValue {
        public Decimal {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public String tag() {
            return "n";
        }

        @Override
        public String canonical() {
            return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record Bool(boolean value) implements FieldValue {
        @Override
        public String tag() {
            return "b";
        }

        @Override
        public String canonical() {
            return Boolean.toString(value);
        }

        @Override
        public Object raw() {
            return value;
        }
    }

    record DateTime(Instant value) implements FieldValue {
        public DateTime {
            Objects.requireNonNull(value, "value is required");
        }

        @Override
        public String tag() {
            return "d";
        }

        @Override
        public String canonical() {
            return value.toString();
        }

        @Override
        public Object raw() {
            return value;
        }
    }
}
