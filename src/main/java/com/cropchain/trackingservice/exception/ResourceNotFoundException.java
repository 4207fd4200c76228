package com.cropchain.trackingservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * No batch exists under the requested identifier (e.g. {@code CROP-2024-001}).
 * Mapped to 404 Not Found.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException forBatch(String batchId) {
        return new ResourceNotFoundException("Batch with ID " + batchId + " not found.");
    }
}
