package com.hinata.backend.global.error;

public class DatabaseException extends InternalServerException {

    public DatabaseException(String code, String detail, Throwable cause) {
        super(code, detail, cause);
    }
}
