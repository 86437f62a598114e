package com.hinata.backend.global.error;

import org.springframework.http.HttpStatus;

public class ConflictException extends ProblemException {

    public ConflictException(String code, String detail) {
        super(HttpStatus.CONFLICT, code, detail);
    }
}
