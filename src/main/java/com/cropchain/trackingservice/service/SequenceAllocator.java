package com.cropchain.trackingservice.service;

import com.cropchain.trackingservice.exception.DataStoreException;
import com.cropchain.trackingservice.repository.CounterRepository;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;

/**
 * Issues the next integer of a named durable counter.
 * <p>
 * Contention is resolved by Firestore, not by this process: the counter document is read and
 * rewritten inside one transaction, so allocations stay unique across any number of service
 * instances. A value handed out by {@link #allocate} is rolled back together with its
 * transaction; a value that collided with an existing batch is retired through
 * {@link #retire} so it is never issued again.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SequenceAllocator {

    private final Firestore firestore;
    private final CounterRepository counterRepository;

    /**
     * Allocates the next value of {@code name} as part of {@code transaction}. Must be called
     * before any write is queued on the transaction.
     */
    public long allocate(Transaction transaction, String name) throws ExecutionException, InterruptedException {
        return counterRepository.incrementAndGet(transaction, name);
    }

    /**
     * Moves the counter to at least {@code sequence} in a transaction of its own. Concurrent
     * callers retiring the same value leave the counter where the first one put it.
     */
    public void retire(String name, long sequence) {
        try {
            long current = firestore.runTransaction(
                    transaction -> counterRepository.advanceTo(transaction, name, sequence)).get();
            log.debug("Counter {} now at {} after retiring {}", name, current, sequence);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataStoreException("Interrupted while retiring sequence " + sequence + " of " + name, e);
        } catch (ExecutionException e) {
            throw new DataStoreException("Failed to retire sequence " + sequence + " of " + name, e.getCause());
        }
    }
}
