package com.example.snapshotcache.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The backing snapshot store could not be reached. A commit that fails this way
 * left the previous snapshot in place.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class StorageUnavailableException extends RuntimeException {
    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
