package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.dto.request.UpdateBatchRequest;
import com.cropchain.trackingservice.exception.BatchRecalledException;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * The "update batch" operation: ownership check, then append.
 */
@Service
@RequiredArgsConstructor
public class BatchUpdateService {

    private final BatchOwnershipGuard ownershipGuard;
    private final BatchUpdateAppender updateAppender;

    public CropBatch updateBatch(CallerIdentity caller, String batchId, UpdateBatchRequest request) {
        // Authorization comes first, so a non-owner is refused whatever the payload looks like.
        CropBatch batch = ownershipGuard.authorize(caller, batchId);
        if (batch.isRecalled()) {
            throw new BatchRecalledException(batchId);
        }
        // the appender checks the flag again inside its transaction
        return updateAppender.appendUpdate(batch, request);
    }
}
