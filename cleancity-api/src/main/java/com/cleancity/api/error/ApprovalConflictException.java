package com.cleancity.api.error;

/**
 * A decision was attempted on a verification that has already been decided.
 */
public class ApprovalConflictException extends WorkflowException {

    public ApprovalConflictException(ErrorCode code, String message) {
        super(code, message);
        if (code != ErrorCode.ALREADY_APPROVED && code != ErrorCode.ALREADY_REJECTED) {
            throw new IllegalArgumentException("Not an approval conflict code: " + code);
        }
    }
}
