package com.resumebuilder.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a version write keeps colliding with concurrent writers after all retries.
 */
public class VersionConflictException extends BizException {

    public VersionConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, "VERSION_CONFLICT", message, cause);
    }
}
