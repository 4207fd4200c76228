package com.cropchain.trackingservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The four supply-chain positions a batch can occupy.
 * The canonical (wire) form is lowercase, e.g. {@code "transport"}.
 */
public enum Stage {
    FARMER,
    MANDI,
    TRANSPORT,
    RETAILER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stage case-insensitively. Leading and trailing whitespace is ignored.
     */
    public static Optional<Stage> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(s -> s.name().equals(normalized)).findFirst();
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(Stage::value).collect(Collectors.joining(", "));
    }
}
