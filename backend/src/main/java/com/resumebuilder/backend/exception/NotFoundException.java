package com.resumebuilder.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * The resume or version does not exist, belongs to another user, or the resume was deleted.
 */
public class NotFoundException extends BizException {

    public NotFoundException(String code, String message) {
        super(HttpStatus.NOT_FOUND, code, message);
    }

    public static NotFoundException resume() {
        return new NotFoundException("RESUME_NOT_FOUND", "Resume not found");
    }

    public static NotFoundException version() {
        return new NotFoundException("VERSION_NOT_FOUND", "Version not found");
    }
}
