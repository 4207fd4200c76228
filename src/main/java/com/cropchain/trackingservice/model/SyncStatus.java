package com.cropchain.trackingservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * State of the batch with respect to the on-chain mirror. Every mutation resets it to
 * {@link #PENDING}; the mirror listener advances it.
 */
public enum SyncStatus {
    PENDING,
    SYNCED,
    ERROR;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
