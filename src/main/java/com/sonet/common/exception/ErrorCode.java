package com.sonet.common.exception;

import lombok.Getter;

@Getter
public enum ErrorCode {
    INVALID_PARAMETER("INVALID_PARAMETER", "Invalid request parameter"),
    BAD_REQUEST("BAD_REQUEST", "Malformed request"),
    UNAUTHORIZED("UNAUTHORIZED", "Missing user identity"),
    NOT_FOUND("NOT_FOUND", "Resource not found"),
    STORAGE_UNAVAILABLE("STORAGE_UNAVAILABLE", "Storage backend unavailable"),
    INTERNAL_ERROR("INTERNAL_ERROR", "Internal server error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }
}
