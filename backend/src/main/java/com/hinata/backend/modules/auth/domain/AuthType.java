package com.hinata.backend.modules.auth.domain;

public enum AuthType {
    LOCAL,
    GOOGLE,
    MICROSOFT,
    GITHUB
}
