package com.cleancity.api.error;

public class StateException extends WorkflowException {

    public StateException(String message) {
        super(ErrorCode.STATE_ERROR, message);
    }
}
