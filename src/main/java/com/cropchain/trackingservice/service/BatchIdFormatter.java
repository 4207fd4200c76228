package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.config.BatchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;

/**
 * Turns an allocated sequence into the external batch identifier, e.g. {@code CROP-2024-007}.
 * The sequence is zero-padded to a minimum of three digits and never truncated, so 1000
 * becomes {@code CROP-2024-1000}.
 */
@Component
@RequiredArgsConstructor
public class BatchIdFormatter {

    private static final String PREFIX = "CROP";

    private final BatchProperties properties;
    private final Clock clock;

    public String format(int year, long sequence) {
        if (year < 0) {
            throw new IllegalArgumentException("Year must not be negative: " + year);
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("Sequence must not be negative: " + sequence);
        }
        return String.format("%s-%d-%03d", PREFIX, year, sequence);
    }

    /**
     * Formats with the configured identifier year, or the current UTC year when none is set.
     */
    public String format(long sequence) {
        return format(identifierYear(), sequence);
    }

    int identifierYear() {
        Integer configured = properties.getBatch().getIdYear();
        if (configured != null) {
            return configured;
        }
        return clock.instant().atZone(ZoneOffset.UTC).getYear();
    }
}
