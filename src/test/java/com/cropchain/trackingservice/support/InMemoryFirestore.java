package com.cropchain.trackingservice.support;

import com.cropchain.trackingservice.model.BatchUpdate;
import com.cropchain.trackingservice.model.CropBatch;
import com.cropchain.trackingservice.model.SyncStatus;
import com.cropchain.trackingservice.repository.CounterRepository;
import com.cropchain.trackingservice.repository.CropBatchRepository;
import com.google.api.core.ApiFutures;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Transaction;
import com.google.cloud.firestore.TransactionOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * A Firestore stand-in for service tests. Transactions run one at a time and are rolled back
 * when their callback throws or their commit is rejected, which is what a serializable
 * Firestore transaction looks like from the caller's side. A rejected commit fails the
 * transaction future with an {@link ApiException}, carrying the status Firestore would use.
 */
public class InMemoryFirestore {

    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, CropBatch> batches = new HashMap<>();
    private final Firestore firestore = mock(Firestore.class);
    private final Transaction transaction = mock(Transaction.class);

    private final CounterRepository counterRepository = new Counters();
    private final CropBatchRepository cropBatchRepository = new Batches();

    private final StatusCode alreadyExists = statusCode(StatusCode.Code.ALREADY_EXISTS);
    private final StatusCode notFound = statusCode(StatusCode.Code.NOT_FOUND);

    private volatile boolean failNextAppend;
    private Runnable afterNextRead;
    private ApiException commitFailure;
    private int transactionCount;

    @SuppressWarnings("unchecked")
    public InMemoryFirestore() {
        when(firestore.runTransaction(any(Transaction.Function.class)))
                .thenAnswer(invocation -> run(invocation.getArgument(0)));
        when(firestore.runTransaction(any(Transaction.Function.class), any(TransactionOptions.class)))
                .thenAnswer(invocation -> run(invocation.getArgument(0)));
    }

    private static StatusCode statusCode(StatusCode.Code code) {
        StatusCode statusCode = mock(StatusCode.class);
        when(statusCode.getCode()).thenReturn(code);
        return statusCode;
    }

    private synchronized Object run(Transaction.Function<?> function) {
        transactionCount++;
        Map<String, Long> countersBefore = new HashMap<>(counters);
        Map<String, CropBatch> batchesBefore = copy(batches);
        commitFailure = null;
        try {
            Object result = function.updateCallback(transaction);
            if (commitFailure != null) {
                throw commitFailure;
            }
            return ApiFutures.immediateFuture(result);
        } catch (Exception e) {
            counters.clear();
            counters.putAll(countersBefore);
            batches.clear();
            batches.putAll(batchesBefore);
            return ApiFutures.immediateFailedFuture(e);
        } finally {
            commitFailure = null;
        }
    }

    private void rejectCommit(StatusCode statusCode, String message) {
        if (commitFailure == null) {
            commitFailure = new ApiException(new IllegalStateException(message), statusCode, false);
        }
    }

    public Firestore firestore() {
        return firestore;
    }

    public CounterRepository counterRepository() {
        return counterRepository;
    }

    public CropBatchRepository cropBatchRepository() {
        return cropBatchRepository;
    }

    public synchronized long counterValue(String name) {
        return counters.getOrDefault(name, 0L);
    }

    public synchronized int transactionCount() {
        return transactionCount;
    }

    /** Stores a batch directly, bypassing the counter. */
    public synchronized void seed(CropBatch batch) {
        batches.put(batch.getBatchId(), batch.toBuilder().updates(new ArrayList<>(batch.getUpdates())).build());
    }

    public synchronized int batchCount() {
        return batches.size();
    }

    /** Makes the commit of the next appended update fail as if the document had been deleted. */
    public void failNextAppend() {
        failNextAppend = true;
    }

    /**
     * Runs {@code action} right after the next read made outside a transaction, as if another
     * client had committed in between.
     */
    public synchronized void afterNextRead(Runnable action) {
        afterNextRead = action;
    }

    private static Map<String, CropBatch> copy(Map<String, CropBatch> source) {
        Map<String, CropBatch> copy = new HashMap<>();
        source.forEach((id, batch) -> copy.put(id, batch.toBuilder().updates(new ArrayList<>(batch.getUpdates())).build()));
        return copy;
    }

    private class Counters implements CounterRepository {

        @Override
        public long incrementAndGet(Transaction tx, String name) {
            synchronized (InMemoryFirestore.this) {
                long next = counters.getOrDefault(name, 0L) + 1;
                counters.put(name, next);
                return next;
            }
        }

        @Override
        public long advanceTo(Transaction tx, String name, long sequence) {
            synchronized (InMemoryFirestore.this) {
                long current = counters.getOrDefault(name, 0L);
                if (current >= sequence) {
                    return current;
                }
                counters.put(name, sequence);
                return sequence;
            }
        }
    }

    private class Batches implements CropBatchRepository {

        @Override
        public void createInTransaction(Transaction tx, CropBatch batch) {
            synchronized (InMemoryFirestore.this) {
                if (batches.containsKey(batch.getBatchId())) {
                    rejectCommit(alreadyExists, "Document already exists: batches/" + batch.getBatchId());
                    return;
                }
                batches.put(batch.getBatchId(), batch.toBuilder().updates(new ArrayList<>(batch.getUpdates())).build());
            }
        }

        @Override
        public Optional<CropBatch> findById(String batchId) {
            synchronized (InMemoryFirestore.this) {
                Optional<CropBatch> found = read(batchId);
                Runnable action = afterNextRead;
                afterNextRead = null;
                if (action != null) {
                    action.run();
                }
                return found;
            }
        }

        @Override
        public Optional<CropBatch> findById(Transaction tx, String batchId) {
            synchronized (InMemoryFirestore.this) {
                return read(batchId);
            }
        }

        private Optional<CropBatch> read(String batchId) {
            return Optional.ofNullable(batches.get(batchId))
                    .map(b -> b.toBuilder().updates(new ArrayList<>(b.getUpdates())).build());
        }

        @Override
        public List<CropBatch> findAll() {
            synchronized (InMemoryFirestore.this) {
                return batches.values().stream()
                        .sorted(Comparator.comparing(CropBatch::getCreatedAt).reversed())
                        .collect(Collectors.toList());
            }
        }

        @Override
        public List<CropBatch> findAllByFarmerId(String farmerId) {
            return findAll().stream()
                    .filter(b -> farmerId.equals(b.getFarmerId()))
                    .collect(Collectors.toList());
        }

        @Override
        public void appendUpdateInTransaction(Transaction tx, String batchId, BatchUpdate update,
                                              String integrityHash, Timestamp updatedAt) {
            synchronized (InMemoryFirestore.this) {
                CropBatch batch = batches.get(batchId);
                if (batch == null || failNextAppend) {
                    failNextAppend = false;
                    rejectCommit(notFound, "No document to update: batches/" + batchId);
                    return;
                }
                batch.getUpdates().add(update);
                batch.setCurrentStage(update.getStage());
                batch.setIntegrityHash(integrityHash);
                batch.setSyncStatus(SyncStatus.PENDING);
                batch.setUpdatedAt(updatedAt);
            }
        }

        @Override
        public void markRecalledInTransaction(Transaction tx, String batchId, String recalledBy,
                                              Timestamp recalledAt, String integrityHash) {
            synchronized (InMemoryFirestore.this) {
                CropBatch batch = batches.get(batchId);
                batch.setRecalled(true);
                batch.setRecalledBy(recalledBy);
                batch.setRecalledAt(recalledAt);
                batch.setIntegrityHash(integrityHash);
                batch.setSyncStatus(SyncStatus.PENDING);
                batch.setUpdatedAt(recalledAt);
            }
        }
    }
}
