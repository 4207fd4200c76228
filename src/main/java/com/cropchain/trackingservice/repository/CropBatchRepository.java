package com.cropchain.trackingservice.repository;

import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.Transaction;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

public interface CropBatchRepository {

    /**
     * Queues the creation of a new batch document. The write carries an "exists = false"
     * precondition: if the id is already taken the whole transaction fails at commit with
     * ALREADY_EXISTS (see {@link FirestoreErrors#isAlreadyExists(Throwable)}).
     */
    void createInTransaction(Transaction transaction, CropBatch batch);

    Optional<CropBatch> findById(String batchId);

    Optional<CropBatch> findById(Transaction transaction, String batchId) throws ExecutionException, InterruptedException;

    /** All batches, newest first. */
    List<CropBatch> findAll();

    /** Batches owned by the given farmer, newest first. */
    List<CropBatch> findAllByFarmerId(String farmerId);

    /**
     * Queues one write that appends a timeline entry and advances the current stage. The
     * caller must have read the batch in the same transaction; the write fails at commit if
     * the document no longer exists.
     */
    void appendUpdateInTransaction(Transaction transaction, String batchId, BatchUpdate update,
                                   String integrityHash, Timestamp updatedAt);

    void markRecalledInTransaction(Transaction transaction, String batchId, String recalledBy,
                                   Timestamp recalledAt, String integrityHash);
}
