package com.cropchain.trackingservice.util;

import com.google.cloud.Timestamp;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Conversions between {@link Clock}/{@link Instant} time and Firestore {@link Timestamp}s.
 */
public final class Timestamps {

    private Timestamps() {
    }

    public static Timestamp now(Clock clock) {
        return of(clock.instant());
    }

    public static Timestamp of(Instant instant) {
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    public static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }

    /** Null-safe {@link Timestamp#toDate()}. */
    public static Date toDate(Timestamp timestamp) {
        return timestamp != null ? timestamp.toDate() : null;
    }
}
