package com.cleancity.api.error;

public class ForbiddenException extends WorkflowException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
