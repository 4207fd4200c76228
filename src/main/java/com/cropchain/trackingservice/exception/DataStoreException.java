package com.cropchain.trackingservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Wraps a Firestore call that failed after the client's own retry policy gave up.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class DataStoreException extends RuntimeException {

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
