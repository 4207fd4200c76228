package com.cropchain.trackingservice.service;

import java.time.Instant;

/**
 * Produces the opaque integrity token stored on a batch after every mutation.
 */
public interface IntegrityHasher {

    String hash(Object content, Instant at);
}
