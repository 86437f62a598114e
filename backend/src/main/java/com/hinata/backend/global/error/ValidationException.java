package com.hinata.backend.global.error;

import org.springframework.http.HttpStatus;

public class ValidationException extends ProblemException {

    public ValidationException(String code, String detail) {
        super(HttpStatus.BAD_REQUEST, code, detail);
    }
}
