package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.exception.BatchAlreadyRecalledException;
import com.cropchain.trackingservice.exception.BatchUpdateException;
import com.cropchain.trackingservice.exception.ForbiddenOperationException;
import com.cropchain.trackingservice.exception.ResourceNotFoundException;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.model.SyncStatus;
import com.cropchain.trackingservice.repository.CropBatchRepository;
import com.cropchain.trackingservice.security.CallerIdentity;
import com.cropchain.trackingservice.util.Timestamps;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.Firestore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ExecutionException;

/**
 * Marks a batch as recalled. There is no way back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchRecallService {

    private final Firestore firestore;
    private final CropBatchRepository cropBatchRepository;
    private final IntegrityHasher integrityHasher;
    private final Clock clock;

    /**
     * Recalls a batch. The check and the write share one transaction, so of two concurrent
     * recalls exactly one succeeds and the other sees {@link BatchAlreadyRecalledException}.
     *
     * @throws ForbiddenOperationException   if the caller is not an administrator
     * @throws ResourceNotFoundException     if the batch does not exist
     * @throws BatchAlreadyRecalledException if the batch was recalled before
     */
    public CropBatch recall(String batchId, CallerIdentity admin) {
        if (!admin.isAdmin()) {
            throw new ForbiddenOperationException("Admin access required to recall a batch.");
        }
        String recalledBy = admin.getEmail() != null ? admin.getEmail() : admin.getUserId();

        try {
            CropBatch recalled = firestore.runTransaction(transaction -> {
                CropBatch batch = cropBatchRepository.findById(transaction, batchId)
                        .orElseThrow(() -> ResourceNotFoundException.forBatch(batchId));
                if (batch.isRecalled()) {
                    throw new BatchAlreadyRecalledException(batchId);
                }

                Timestamp now = Timestamps.now(clock);
                CropBatch result = batch.toBuilder()
                        .recalled(true)
                        .recalledBy(recalledBy)
                        .recalledAt(now)
                        .syncStatus(SyncStatus.PENDING)
                        .updatedAt(now)
                        .build();
                String integrityHash = integrityHasher.hash(result, clock.instant());
                result.setIntegrityHash(integrityHash);

                cropBatchRepository.markRecalledInTransaction(transaction, batchId, recalledBy, now, integrityHash);
                return result;
            }).get();

            log.warn("RECALL by admin {} for batch {}", recalledBy, batchId);
            return recalled;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchUpdateException("Interrupted while recalling batch " + batchId + ".", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ResourceNotFoundException) {
                throw (ResourceNotFoundException) cause;
            }
            if (cause instanceof BatchAlreadyRecalledException) {
                log.warn("Repeated recall of batch {} by admin {}", batchId, recalledBy);
                throw (BatchAlreadyRecalledException) cause;
            }
            throw new BatchUpdateException("Failed to recall batch " + batchId + ".", cause);
        }
    }
}
