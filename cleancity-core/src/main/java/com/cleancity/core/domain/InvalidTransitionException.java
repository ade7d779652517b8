package com.cleancity.core.domain;

/**
 * Raised by the report entity when a status change is not in the transition table.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final ReportStatus from;
    private final ReportStatus to;

    public InvalidTransitionException(ReportStatus from, ReportStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public ReportStatus getFrom() { return from; }
    public ReportStatus getTo() { return to; }
}
