package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.dto.request.UpdateBatchRequest;
import com.cropchain.trackingservice.exception.BatchRecalledException;
import com.cropchain.trackingservice.exception.BatchUpdateException;
import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.model.Stage;
import com.cropchain.trackingservice.model.SyncStatus;
import com.cropchain.trackingservice.repository.CropBatchRepository;
import com.cropchain.trackingservice.util.Timestamps;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.Firestore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

/**
 * Appends one entry to the timeline of an already authorized batch.
 * <p>
 * Any stage may follow any other: the service records the chain as reported and does not
 * enforce farmer → mandi → transport → retailer ordering.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchUpdateAppender {

    private final Firestore firestore;
    private final CropBatchRepository cropBatchRepository;
    private final BatchPayloadValidator payloadValidator;
    private final IntegrityHasher integrityHasher;
    private final Clock clock;

    /**
     * Re-reads the batch and writes the new entry in one Firestore transaction, so the
     * returned timeline is the stored one and a recall committed in the meantime is seen.
     *
     * @param batch   The batch returned by {@link BatchOwnershipGuard#authorize}.
     * @param request The proposed entry; the stage is matched case-insensitively.
     * @return The batch as stored after the write: one more entry, current stage advanced.
     * @throws BatchRecalledException if the batch is recalled by the time the write runs
     * @throws BatchUpdateException   if the batch is gone or the write fails
     */
    public CropBatch appendUpdate(CropBatch batch, UpdateBatchRequest request) {
        Stage stage = payloadValidator.validateUpdate(request);
        String batchId = batch.getBatchId();

        try {
            CropBatch updated = firestore.runTransaction(transaction -> {
                CropBatch current = cropBatchRepository.findById(transaction, batchId)
                        .orElseThrow(() -> new BatchUpdateException("Batch " + batchId + " no longer exists.", null));
                if (current.isRecalled()) {
                    throw new BatchRecalledException(batchId);
                }

                Timestamp now = Timestamps.now(clock);
                BatchUpdate update = BatchUpdate.builder()
                        .updateId(UUID.randomUUID().toString())
                        .stage(stage)
                        .actor(request.getActor().trim())
                        .location(request.getLocation().trim())
                        .timestamp(request.getTimestamp() != null ? Timestamp.of(request.getTimestamp()) : now)
                        .notes(StringUtils.hasText(request.getNotes()) ? request.getNotes().trim() : null)
                        .build();
                String integrityHash = integrityHasher.hash(update, clock.instant());

                cropBatchRepository.appendUpdateInTransaction(transaction, batchId, update, integrityHash, now);

                List<BatchUpdate> timeline = new ArrayList<>();
                if (current.getUpdates() != null) {
                    timeline.addAll(current.getUpdates());
                }
                timeline.add(update);
                return current.toBuilder()
                        .updates(timeline)
                        .currentStage(stage)
                        .integrityHash(integrityHash)
                        .syncStatus(SyncStatus.PENDING)
                        .updatedAt(now)
                        .build();
            }).get();

            log.info("Batch updated: {} to stage {}", batchId, stage.value());
            return updated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchUpdateException("Interrupted while updating batch " + batchId + ".", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BatchRecalledException) {
                log.warn("Update rejected: batch {} was recalled", batchId);
                throw (BatchRecalledException) cause;
            }
            if (cause instanceof BatchUpdateException) {
                throw (BatchUpdateException) cause;
            }
            log.error("Error updating batch {}", batchId, cause);
            throw new BatchUpdateException("Failed to update batch " + batchId + ".", cause);
        }
    }
}
