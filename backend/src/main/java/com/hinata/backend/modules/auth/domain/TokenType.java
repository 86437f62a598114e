package com.hinata.backend.modules.auth.domain;

public enum TokenType {
    HMAC,
    EDDSA
}
