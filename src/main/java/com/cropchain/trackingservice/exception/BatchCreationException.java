package com.cropchain.trackingservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Batch creation failed: either identifier allocation kept colliding until the retry budget
 * was spent, or the store rejected the write for another reason.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class BatchCreationException extends RuntimeException {

    public BatchCreationException(String message) {
        super(message);
    }

    public BatchCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
