package com.tablesync.api.dto.response;

import com.tablesync.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body returned by {@link com.tablesync.exception.GlobalExceptionHandler}.
 */
@Getter
@Builder
public class ApiErrorResponse {

    private final String code;
    private final String message;
    private final Map<String, Object> details;
    private final String path;
    private final Instant timestamp;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ApiErrorResponse.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details != null ? details : Map.of())
                .path(path)
                .timestamp(Instant.now())
                .build();
    }
}
