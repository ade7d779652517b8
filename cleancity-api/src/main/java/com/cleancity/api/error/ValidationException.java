package com.cleancity.api.error;

import java.util.Map;

public class ValidationException extends WorkflowException {

    private final String field;

    public ValidationException(String field, String message) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("field", field), null);
        this.field = field;
    }

    public String getField() { return field; }
}
