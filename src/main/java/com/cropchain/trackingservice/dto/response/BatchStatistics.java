package com.cropchain.trackingservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchStatistics {
    private long totalBatches;
    private long totalFarmers; // distinct farmer ids
    private double totalQuantity;
    private long recentBatches; // created in the last 30 days
    private long recalledBatches;
}
