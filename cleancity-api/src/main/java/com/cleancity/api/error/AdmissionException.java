package com.cleancity.api.error;

import java.util.Map;

/**
 * Report submission refused by a quota or freshness rule.
 */
public class AdmissionException extends WorkflowException {

    public AdmissionException(ErrorCode code, String message, Long retryAfterSeconds) {
        super(code, message, Map.of(), retryAfterSeconds);
    }

    public AdmissionException(ErrorCode code, String message, Map<String, Object> details) {
        super(code, message, details, null);
    }
}
