package com.cropchain.trackingservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

public enum CropType {
    RICE,
    WHEAT,
    CORN,
    TOMATO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<CropType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(c -> c.name().equals(normalized)).findFirst();
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(CropType::value).collect(Collectors.joining(", "));
    }
}
