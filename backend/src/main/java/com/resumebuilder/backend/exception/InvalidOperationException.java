package com.resumebuilder.backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidOperationException extends BizException {

    public InvalidOperationException(String code, String message) {
        super(HttpStatus.BAD_REQUEST, code, message);
    }
}
