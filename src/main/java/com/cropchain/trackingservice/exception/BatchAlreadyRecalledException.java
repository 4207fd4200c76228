package com.cropchain.trackingservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Custom exception thrown when a recall is requested for a batch that has already been
 * recalled.
 * <p>
 * Recall is a one-way transition. A repeated attempt is reported instead of being accepted
 * silently, so operators learn that the recall already happened. It maps to a 409 Conflict
 * HTTP status.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class BatchAlreadyRecalledException extends RuntimeException {

    public BatchAlreadyRecalledException(String batchId) {
        super("Batch " + batchId + " has already been recalled.");
    }
}
