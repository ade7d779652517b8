package com.cleancity.core.domain;

/**
 * Citizen-assessed severity of a waste hotspot.
 * An unset severity is treated as LOW wherever a value is needed.
 */
public enum Severity {
    LOW(10, 15),
    MEDIUM(50, 30),
    HIGH(100, 60);

    private final int priorityWeight;
    private final int estimatedCleanupMinutes;

    Severity(int priorityWeight, int estimatedCleanupMinutes) {
        this.priorityWeight = priorityWeight;
        this.estimatedCleanupMinutes = estimatedCleanupMinutes;
    }

    public int getPriorityWeight() { return priorityWeight; }
    public int getEstimatedCleanupMinutes() { return estimatedCleanupMinutes; }

    public static Severity orDefault(Severity severity) {
        return severity == null ? LOW : severity;
    }
}
