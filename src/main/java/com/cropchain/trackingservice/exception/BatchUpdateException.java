package com.cropchain.trackingservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * A write against an existing batch failed, typically because the batch was deleted
 * concurrently or the store is unavailable. Not retried.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class BatchUpdateException extends RuntimeException {

    public BatchUpdateException(String message, Throwable cause) {
        super(message, cause);
    }
}
