package com.cleancity.api.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every rejection raised by the report workflow. Carries the error code,
 * optional structured details, and a retry-after hint for retryable rejections.
 */
public class WorkflowException extends RuntimeException {

    private final ErrorCode code;
    private final Map<String, Object> details;
    private final Long retryAfterSeconds;

    public WorkflowException(ErrorCode code, String message) {
        this(code, message, Map.of(), null);
    }

    public WorkflowException(ErrorCode code, String message, Map<String, Object> details, Long retryAfterSeconds) {
        super(message);
        this.code = code;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public ErrorCode getCode() { return code; }
    public Map<String, Object> getDetails() { return details; }
    public Long getRetryAfterSeconds() { return retryAfterSeconds; }
}
