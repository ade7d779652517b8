package com.cleancity.api.task;

import com.cleancity.core.domain.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Urgency ordering for worker task lists.
 *
 * priority = severity weight (HIGH 100, MEDIUM 50, LOW or unset 10) + age in hours.
 */
public final class TaskPriority {

    private TaskPriority() {}

    public static double priority(Severity severity, Instant reportedAt, Instant now) {
        return Severity.orDefault(severity).getPriorityWeight() + ageInHours(reportedAt, now);
    }

    public static double ageInHours(Instant reportedAt, Instant now) {
        return Duration.between(reportedAt, now).toMillis() / 3_600_000.0;
    }

    /**
     * Ranks snapshots by descending priority. The sort is stable, so equal priorities
     * keep their input order.
     */
    public static List<RankedTask> rank(List<TaskSnapshot> snapshots, Instant now) {
        List<RankedTask> ranked = new ArrayList<>(snapshots.size());
        for (TaskSnapshot snapshot : snapshots) {
            ranked.add(new RankedTask(snapshot, priority(snapshot.severity(), snapshot.createdAt(), now)));
        }
        ranked.sort(Comparator.comparingDouble(RankedTask::priority).reversed());
        return ranked;
    }

    public record RankedTask(TaskSnapshot snapshot, double priority) {}
}
