package com.cropchain.trackingservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A durable, named sequence. Stored in the {@code counters} collection with the name as
 * document id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Counter {
    private String name;
    private long sequence;
}
