package com.cropchain.trackingservice.repository;

import com.google.cloud.firestore.Transaction;

import java.util.concurrent.ExecutionException;

/**
 * Durable named sequences. Both operations read the counter document before writing it, so
 * they must be the first writes queued on the transaction.
 */
public interface CounterRepository {

    /**
     * Increments the named counter inside the transaction and returns the new value. A missing
     * counter is created with value 1.
     */
    long incrementAndGet(Transaction transaction, String name) throws ExecutionException, InterruptedException;

    /**
     * Raises the named counter to {@code sequence} unless it is already at or above it.
     *
     * @return the counter value after the call
     */
    long advanceTo(Transaction transaction, String name, long sequence) throws ExecutionException, InterruptedException;
}
