package com.tablesync.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_SUBSCRIPTION("INVALID_SUBSCRIPTION", 400),
    NOT_FOUND("NOT_FOUND", 404),
    STALE_OPTIMISTIC_PATCH("STALE_OPTIMISTIC_PATCH", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    TRANSPORT_ERROR("TRANSPORT_ERROR", 502),
    CHANNEL_CLOSED("CHANNEL_CLOSED", 503);

    private final String code;
    private final int httpStatus;
}
