package com.cropchain.trackingservice.dto.response;

import com.cropchain.trackingservice.model.BatchUpdate;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Only the ordered supply-chain entries of a batch, oldest first.
 */
@Data
@Builder
public class TimelineResponse {
    private String batchId;
    private List<BatchResponse.UpdateEntry> timeline;

    public static TimelineResponse of(String batchId, List<BatchUpdate> updates) {
        return TimelineResponse.builder()
                .batchId(batchId)
                .timeline(updates.stream().map(BatchResponse.UpdateEntry::from).collect(Collectors.toList()))
                .build();
    }
}
