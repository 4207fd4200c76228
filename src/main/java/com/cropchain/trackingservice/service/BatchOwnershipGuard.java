package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.exception.ForbiddenOperationException;
import com.cropchain.trackingservice.exception.ResourceNotFoundException;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.repository.CropBatchRepository;
import com.cropchain.trackingservice.security.CallerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides whether a caller may append to a batch's timeline.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchOwnershipGuard {

    private final CropBatchRepository cropBatchRepository;

    /**
     * Loads the batch and checks that the caller is an administrator or its owner. The owner
     * matches on either the caller's user id or farmer id.
     *
     * @return the loaded batch, to be handed to the next step instead of being read again
     * @throws ResourceNotFoundException   if no batch has this identifier
     * @throws ForbiddenOperationException if the caller neither owns the batch nor is an admin
     */
    public CropBatch authorize(CallerIdentity caller, String batchId) {
        CropBatch batch = cropBatchRepository.findById(batchId)
                .orElseThrow(() -> ResourceNotFoundException.forBatch(batchId));

        if (caller.isAdmin() || caller.owns(batch.getFarmerId())) {
            return batch;
        }

        log.warn("[AUTH FAIL] User {} attempted to update batch {} owned by {}",
                caller.getUserId(), batchId, batch.getFarmerId());
        throw new ForbiddenOperationException("Not authorized to update this batch.");
    }
}
