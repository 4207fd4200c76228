package com.cropchain.trackingservice.dto.response;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class BatchListResponse {
    private BatchStatistics stats;
    private List<BatchResponse> batches;
}
