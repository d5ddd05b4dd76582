package com.example.snapshotcache.web;

import com.example.snapshotcache.exception.SnapshotNotFoundException;
import com.example.snapshotcache.exception.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps cache exceptions to HTTP responses. Refresh failures never get here: they are
 * reported as outcomes, and reads keep serving the last good snapshot.
 */
@RestControllerAdvice
public class SnapshotExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExceptionHandler.class);

    @ExceptionHandler(SnapshotNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(SnapshotNotFoundException ex) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorBody(ex.getMessage()));
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<ErrorBody> handleStorageUnavailable(StorageUnavailableException ex) {
        log.warn("Snapshot store unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorBody(ex.getMessage()));
    }

    // Lease lookups talk to Redis directly when leases are shared.
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorBody> handleDataAccess(DataAccessException ex) {
        log.warn("Cache backend unavailable: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorBody("Cache backend unavailable"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorBody> handleBadArgument(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ErrorBody("Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'"));
    }

    public record ErrorBody(String message) {}
}
