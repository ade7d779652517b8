package com.cleancity.core.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a waste report.
 *
 * OPEN -> ASSIGNED -> IN_PROGRESS -> VERIFIED -> RESOLVED, plus two backward edges:
 * ASSIGNED -> OPEN (unassign) and VERIFIED -> ASSIGNED (verification rejected).
 * RESOLVED is terminal.
 */
public enum ReportStatus {
    OPEN,
    ASSIGNED,
    IN_PROGRESS,
    VERIFIED,
    RESOLVED;

    private static final Map<ReportStatus, Set<ReportStatus>> TRANSITIONS;

    static {
        Map<ReportStatus, Set<ReportStatus>> transitions = new EnumMap<>(ReportStatus.class);
        transitions.put(OPEN, EnumSet.of(ASSIGNED));
        transitions.put(ASSIGNED, EnumSet.of(IN_PROGRESS, OPEN));
        transitions.put(IN_PROGRESS, EnumSet.of(VERIFIED));
        transitions.put(VERIFIED, EnumSet.of(RESOLVED, ASSIGNED));
        transitions.put(RESOLVED, EnumSet.noneOf(ReportStatus.class));
        TRANSITIONS = Collections.unmodifiableMap(transitions);
    }

    public Set<ReportStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(ReportStatus target) {
        return target != null && target != this && TRANSITIONS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * Throws when {@code target} is not a legal successor of {@code current}.
     */
    public static void requireTransition(ReportStatus current, ReportStatus target) {
        if (current == target) {
            throw new InvalidTransitionException(current, target, "Status is already " + current);
        }
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(current, target,
                    current.isTerminal()
                            ? current + " is terminal"
                            : "Cannot transition from " + current + " to " + target
                                    + "; allowed: " + current.allowedTargets());
        }
    }
}
