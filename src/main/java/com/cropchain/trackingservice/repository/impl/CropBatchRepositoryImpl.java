package com.cropchain.trackingservice.repository.impl;

import com.cropchain.trackingservice.exception.DataStoreException;
import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.model.SyncStatus;
import com.cropchain.trackingservice.repository.CropBatchRepository;
import com.google.api.core.ApiFuture;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.FieldValue;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Batches live in {@code batches/{batchId}} with the timeline embedded as an array field.
 */
@RequiredArgsConstructor
@Slf4j
public class CropBatchRepositoryImpl implements CropBatchRepository {

    static final String COLLECTION = "batches";

    private final Firestore firestore;

    @Override
    public void createInTransaction(Transaction transaction, CropBatch batch) {
        transaction.create(document(batch.getBatchId()), batch);
    }

    @Override
    public Optional<CropBatch> findById(String batchId) {
        DocumentSnapshot snapshot = await(document(batchId).get(), "read batch " + batchId);
        return toBatch(snapshot);
    }

    @Override
    public Optional<CropBatch> findById(Transaction transaction, String batchId) throws ExecutionException, InterruptedException {
        return toBatch(transaction.get(document(batchId)).get());
    }

    @Override
    public List<CropBatch> findAll() {
        QuerySnapshot querySnapshot = await(
                collection().orderBy("createdAt", Query.Direction.DESCENDING).get(), "list batches");
        return querySnapshot.getDocuments().stream()
                .map(doc -> doc.toObject(CropBatch.class))
                .collect(Collectors.toList());
    }

    @Override
    public List<CropBatch> findAllByFarmerId(String farmerId) {
        // Sorted in memory: ordering on a second field would need a composite index.
        QuerySnapshot querySnapshot = await(
                collection().whereEqualTo("farmerId", farmerId).get(), "list batches of farmer " + farmerId);
        return querySnapshot.getDocuments().stream()
                .map(doc -> doc.toObject(CropBatch.class))
                .sorted(Comparator.<CropBatch, Timestamp>comparing(CropBatch::getCreatedAt,
                        Comparator.nullsFirst(Comparator.<Timestamp>naturalOrder())).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public void appendUpdateInTransaction(Transaction transaction, String batchId, BatchUpdate update,
                                          String integrityHash, Timestamp updatedAt) {
        Map<String, Object> fields = new HashMap<>();
        // Every entry carries its own updateId, so arrayUnion never folds two entries together.
        fields.put("updates", FieldValue.arrayUnion(toDocument(update)));
        fields.put("currentStage", update.getStage().name());
        fields.put("integrityHash", integrityHash);
        fields.put("syncStatus", SyncStatus.PENDING.name());
        fields.put("updatedAt", updatedAt);

        // update() requires the document to exist, so a concurrently deleted batch fails the commit
        transaction.update(document(batchId), fields);
    }

    @Override
    public void markRecalledInTransaction(Transaction transaction, String batchId, String recalledBy,
                                          Timestamp recalledAt, String integrityHash) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("recalled", true);
        fields.put("recalledBy", recalledBy);
        fields.put("recalledAt", recalledAt);
        fields.put("integrityHash", integrityHash);
        fields.put("syncStatus", SyncStatus.PENDING.name());
        fields.put("updatedAt", recalledAt);
        transaction.update(document(batchId), fields);
    }

    static Map<String, Object> toDocument(BatchUpdate update) {
        Map<String, Object> entry = new HashMap<>();
        entry.put("updateId", update.getUpdateId());
        entry.put("stage", update.getStage().name());
        entry.put("actor", update.getActor());
        entry.put("location", update.getLocation());
        entry.put("timestamp", update.getTimestamp());
        if (update.getNotes() != null) {
            entry.put("notes", update.getNotes());
        }
        return entry;
    }

    private static Optional<CropBatch> toBatch(DocumentSnapshot snapshot) {
        if (!snapshot.exists()) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.toObject(CropBatch.class));
    }

    private static <T> T await(ApiFuture<T> future, String operation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataStoreException("Interrupted while trying to " + operation, e);
        } catch (ExecutionException e) {
            log.error("Firestore call failed: {}", operation, e.getCause());
            throw new DataStoreException("Failed to " + operation, e.getCause());
        }
    }

    private DocumentReference document(String batchId) {
        return collection().document(batchId);
    }

    private CollectionReference collection() {
        return firestore.collection(COLLECTION);
    }
}
