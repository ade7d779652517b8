package com.cleancity.api.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        Map<String, Object> details,
        Long retryAfterSeconds,
        Instant timestamp
) {
    public static ErrorResponse of(ErrorCode code, String message, Instant timestamp) {
        return new ErrorResponse(code.name(), message, null, null, timestamp);
    }
}
