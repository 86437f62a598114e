package com.hinata.backend.global.error;

import org.springframework.http.HttpStatus;

public class UnauthorizedException extends ProblemException {

    public UnauthorizedException(String code, String detail) {
        super(HttpStatus.UNAUTHORIZED, code, detail);
    }
}
