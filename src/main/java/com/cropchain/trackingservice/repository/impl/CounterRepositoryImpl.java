package com.cropchain.trackingservice.repository.impl;

import com.cropchain.trackingservice.model.Counter;
import com.cropchain.trackingservice.repository.CounterRepository;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Transaction;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.ExecutionException;

/**
 * Counters live in {@code counters/{name}}. The read and the write of one call happen in the
 * caller's transaction, which Firestore commits atomically, so two concurrent callers can
 * never be handed the same value.
 */
@RequiredArgsConstructor
public class CounterRepositoryImpl implements CounterRepository {

    static final String COLLECTION = "counters";

    private final Firestore firestore;

    @Override
    public long incrementAndGet(Transaction transaction, String name) throws ExecutionException, InterruptedException {
        DocumentReference counterRef = document(name);
        long next = currentSequence(transaction.get(counterRef).get()) + 1;
        transaction.set(counterRef, Counter.builder().name(name).sequence(next).build());
        return next;
    }

    @Override
    public long advanceTo(Transaction transaction, String name, long sequence) throws ExecutionException, InterruptedException {
        DocumentReference counterRef = document(name);
        long current = currentSequence(transaction.get(counterRef).get());
        if (current >= sequence) {
            return current;
        }
        transaction.set(counterRef, Counter.builder().name(name).sequence(sequence).build());
        return sequence;
    }

    private static long currentSequence(DocumentSnapshot snapshot) {
        if (!snapshot.exists()) {
            return 0L;
        }
        Long sequence = snapshot.getLong("sequence");
        return sequence != null ? sequence : 0L;
    }

    private DocumentReference document(String name) {
        return collection().document(name);
    }

    private CollectionReference collection() {
        return firestore.collection(COLLECTION);
    }
}
