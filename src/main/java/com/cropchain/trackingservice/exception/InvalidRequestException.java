package com.cropchain.trackingservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a batch payload violates the data model constraints, e.g. a quantity outside
 * (0, 1,000,000] or a harvest date in the future. The caller can recover by correcting the
 * input; the service never retries it.
 */
@Getter
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidRequestException extends RuntimeException {

    /** The offending request field, or {@code null} when the error is not field specific. */
    private final String field;

    public InvalidRequestException(String message) {
        this(null, message);
    }

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }
}
