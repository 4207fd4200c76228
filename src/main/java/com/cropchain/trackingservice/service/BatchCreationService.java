package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.config.BatchProperties;
import com.cropchain.trackingservice.dto.request.CreateBatchRequest;
import com.cropchain.trackingservice.exception.BatchCreationException;
import com.cropchain.trackingservice.exception.DataStoreException;
import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.model.CropType;
import com.cropchain.trackingservice.model.Stage;
import com.cropchain.trackingservice.model.SyncStatus;
import com.cropchain.trackingservice.repository.CropBatchRepository;
import com.cropchain.trackingservice.repository.FirestoreErrors;
import com.cropchain.trackingservice.security.CallerIdentity;
import com.cropchain.trackingservice.util.Timestamps;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.TransactionOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;

@Service
@RequiredArgsConstructor
@Slf4j
public class BatchCreationService {

    static final String DEFAULT_INITIAL_NOTES = "Initial harvest recorded";

    private final Firestore firestore;
    private final SequenceAllocator sequenceAllocator;
    private final BatchIdFormatter batchIdFormatter;
    private final CropBatchRepository cropBatchRepository;
    private final BatchPayloadValidator payloadValidator;
    private final QrCodeGenerator qrCodeGenerator;
    private final IntegrityHasher integrityHasher;
    private final BatchProperties properties;
    private final Clock clock;

    /**
     * Creates a new batch owned by the caller.
     * <p>
     * Sequence allocation and the batch insert run in one Firestore transaction, so the
     * identifier and the document are committed together or not at all. If the commit is
     * rejected because the formatted identifier already exists, the collided sequence is
     * retired and the whole transaction is retried, bounded by the configured attempt count
     * and timeout. Any other failure is reported without retry.
     *
     * @param caller  The authenticated caller; becomes the batch owner.
     * @param request The validated request DTO.
     * @return The newly created batch, including its single initial "farmer" entry.
     */
    public CropBatch createBatch(CallerIdentity caller, CreateBatchRequest request) {
        CropType cropType = payloadValidator.validateNewBatch(request);

        String counterName = properties.getBatch().getCounterName();
        BatchProperties.Creation creation = properties.getBatch().getCreation();
        int maxAttempts = creation.getMaxAttempts();
        Instant deadline = clock.instant().plus(creation.getTimeout());
        TransactionOptions options = TransactionOptions.createReadWriteOptionsBuilder()
                .setNumberOfAttempts(creation.getTransactionAttempts())
                .build();

        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            AtomicLong allocated = new AtomicLong(-1);
            try {
                CropBatch created = firestore.runTransaction(transaction -> {
                    long sequence = sequenceAllocator.allocate(transaction, counterName);
                    allocated.set(sequence);

                    CropBatch batch = assembleBatch(batchIdFormatter.format(sequence), caller, request, cropType);
                    cropBatchRepository.createInTransaction(transaction, batch);
                    return batch;
                }, options).get();

                log.info("Batch created: {} by user {} ({})", created.getBatchId(), caller.getUserId(), caller.getEmail());
                return created;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BatchCreationException("Interrupted while creating batch.", e);
            } catch (ExecutionException e) {
                if (!FirestoreErrors.isAlreadyExists(e)) {
                    log.error("Error creating batch for user {}", caller.getUserId(), e.getCause());
                    throw new BatchCreationException("Failed to create batch.", e.getCause());
                }
                log.warn("Batch ID collision on sequence {} of counter {} (attempt {}/{})",
                        allocated.get(), counterName, attempt, maxAttempts);
                retireCollidedSequence(counterName, allocated.get());
            }

            if (clock.instant().isAfter(deadline)) {
                log.warn("Batch creation timed out after {} attempt(s)", attempt);
                break;
            }
        }

        throw new BatchCreationException(
                "Could not allocate a unique batch ID after " + attempt + " attempt(s).");
    }

    private void retireCollidedSequence(String counterName, long sequence) {
        if (sequence < 0) {
            return;
        }
        try {
            sequenceAllocator.retire(counterName, sequence);
        } catch (DataStoreException e) {
            throw new BatchCreationException("Failed to create batch.", e);
        }
    }

    private CropBatch assembleBatch(String batchId, CallerIdentity caller, CreateBatchRequest request, CropType cropType) {
        Timestamp now = Timestamps.now(clock);
        Timestamp harvestDate = Timestamp.of(request.getHarvestDate());
        String farmerName = StringUtils.hasText(request.getFarmerName())
                ? request.getFarmerName().trim()
                : caller.ownerId();
        String origin = request.getOrigin().trim();

        BatchUpdate initialEntry = BatchUpdate.builder()
                .updateId(UUID.randomUUID().toString())
                .stage(Stage.FARMER)
                .actor(farmerName)
                .location(origin)
                .timestamp(harvestDate)
                .notes(StringUtils.hasText(request.getDescription()) ? request.getDescription().trim() : DEFAULT_INITIAL_NOTES)
                .build();
        List<BatchUpdate> updates = new ArrayList<>();
        updates.add(initialEntry);

        CropBatch batch = CropBatch.builder()
                .batchId(batchId)
                .farmerId(caller.ownerId())
                .farmerName(farmerName)
                .farmerAddress(trimToNull(request.getFarmerAddress()))
                .cropType(cropType)
                .quantity(request.getQuantity())
                .harvestDate(harvestDate)
                .origin(origin)
                .certifications(trimToNull(request.getCertifications()))
                .description(trimToNull(request.getDescription()))
                .currentStage(Stage.FARMER)
                .recalled(false)
                .qrCode(qrCodeGenerator.generate(batchId))
                .syncStatus(SyncStatus.PENDING)
                .updates(updates)
                .createdAt(now)
                .updatedAt(now)
                .build();
        batch.setIntegrityHash(integrityHasher.hash(batch, clock.instant()));
        return batch;
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
