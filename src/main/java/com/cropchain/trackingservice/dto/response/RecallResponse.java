package com.cropchain.trackingservice.dto.response;

import com.cropchain.trackingservice.model.CropBatch;
import lombok.Builder;
import lombok.Data;

import java.util.Date;

@Data
@Builder
public class RecallResponse {
    private String message;
    private String recalledBy;
    private Date recalledAt;
    private BatchResponse batch;

    public static RecallResponse from(CropBatch batch) {
        BatchResponse view = BatchResponse.from(batch);
        return RecallResponse.builder()
                .message("Batch " + batch.getBatchId() + " has been recalled.")
                .recalledBy(batch.getRecalledBy())
                .recalledAt(view.getRecalledAt())
                .batch(view)
                .build();
    }
}
