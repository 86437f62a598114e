package com.hinata.backend.global.error;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends ProblemException {

    public ForbiddenException(String code, String detail) {
        super(HttpStatus.FORBIDDEN, code, detail);
    }
}
