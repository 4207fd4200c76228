package com.cropchain.trackingservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a supply-chain update targets a batch that has been recalled.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class BatchRecalledException extends RuntimeException {

    public BatchRecalledException(String batchId) {
        super("Batch " + batchId + " has been recalled and can no longer be updated.");
    }
}
