package com.cleancity.api.error;

public class NotFoundException extends WorkflowException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
