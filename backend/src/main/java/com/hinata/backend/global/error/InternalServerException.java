package com.hinata.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * 예상하지 못한 서버 오류. 상세 내용은 로그에만 남기고 클라이언트에는 보내지 않는다.
 */
public class InternalServerException extends ProblemException {

    public InternalServerException(String code, String detail) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, code, detail);
    }

    public InternalServerException(String code, String detail, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, code, detail, cause);
    }
}
