package com.cleancity.api.error;

import java.util.Map;

/**
 * Cleanup was completed outside the allowed time window after start.
 */
public class TimingException extends WorkflowException {

    private final double elapsedMinutes;

    public TimingException(double elapsedMinutes, int minMinutes, int maxMinutes) {
        super(ErrorCode.TIMING_ERROR,
                elapsedMinutes < minMinutes
                        ? String.format("Task completed too quickly (%.1f minutes). Minimum is %d minutes.",
                                elapsedMinutes, minMinutes)
                        : String.format("Task took too long (%.1f minutes). Maximum is %d minutes.",
                                elapsedMinutes, maxMinutes),
                Map.of("elapsedMinutes", Math.round(elapsedMinutes * 10) / 10.0,
                        "minMinutes", minMinutes,
                        "maxMinutes", maxMinutes),
                null);
        this.elapsedMinutes = elapsedMinutes;
    }

    public double getElapsedMinutes() { return elapsedMinutes; }
}
