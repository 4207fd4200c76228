package com.cropchain.trackingservice.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A global exception handler to provide consistent, detailed error responses
 * for all controllers in the application.
 * <p>
 * Every body carries an {@code error} code and a human-readable {@code message}.
 */
@ControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handles validation exceptions thrown by @Valid on request bodies.
     * It extracts all field errors and formats them into a structured JSON response.
     *
     * @param ex The MethodArgumentNotValidException that was thrown.
     * @return A ResponseEntity with a 400 Bad Request status, the error code and a message per invalid field.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        errors.put("error", "VALIDATION_ERROR");
        errors.put("message", "Request validation failed.");
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            errors.put(fieldName, error.getDefaultMessage());
        });
        return new ResponseEntity<>(errors, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request body.");
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidRequestException ex) {
        ResponseEntity<Map<String, String>> response = body(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
        if (ex.getField() != null) {
            response.getBody().put("field", ex.getField());
        }
        return response;
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleResourceNotFoundException(ResourceNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(ForbiddenOperationException.class)
    public ResponseEntity<Map<String, String>> handleForbidden(ForbiddenOperationException ex) {
        return body(HttpStatus.FORBIDDEN, "FORBIDDEN", ex.getMessage());
    }

    // @PreAuthorize failures thrown from inside the MVC layer
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, String>> handleAccessDenied(AccessDeniedException ex) {
        return body(HttpStatus.FORBIDDEN, "FORBIDDEN", "Access denied.");
    }

    @ExceptionHandler(BatchAlreadyRecalledException.class)
    public ResponseEntity<Map<String, String>> handleAlreadyRecalled(BatchAlreadyRecalledException ex) {
        return body(HttpStatus.CONFLICT, "ALREADY_RECALLED", ex.getMessage());
    }

    @ExceptionHandler(BatchRecalledException.class)
    public ResponseEntity<Map<String, String>> handleRecalled(BatchRecalledException ex) {
        return body(HttpStatus.CONFLICT, "BATCH_RECALLED", ex.getMessage());
    }

    @ExceptionHandler(BatchCreationException.class)
    public ResponseEntity<Map<String, String>> handleCreationFailed(BatchCreationException ex) {
        log.error("Batch creation failed", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "BATCH_CREATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(BatchUpdateException.class)
    public ResponseEntity<Map<String, String>> handleUpdateFailed(BatchUpdateException ex) {
        log.error("Batch update failed", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "BATCH_UPDATE_ERROR", ex.getMessage());
    }

    @ExceptionHandler(DataStoreException.class)
    public ResponseEntity<Map<String, String>> handleDataStore(DataStoreException ex) {
        log.error("Data store unavailable", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
