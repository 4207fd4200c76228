package com.cropchain.trackingservice.model;

import com.google.cloud.Timestamp;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One immutable entry in a batch's supply-chain timeline. Embedded in the batch document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchUpdate {
    private String updateId;
    private Stage stage;
    private String actor;
    private String location;
    private Timestamp timestamp;
    private String notes; // Optional
}
