package com.cleancity.api.task;

import com.cleancity.api.task.TaskPriority.RankedTask;
import com.cleancity.api.worker.WorkerService;
import com.cleancity.core.domain.GeoLocation;
import com.cleancity.core.domain.ReportStatus;
import com.cleancity.core.domain.Severity;
import com.cleancity.core.domain.Worker;
import com.cleancity.core.repository.ReportRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds a worker's prioritized task list: OPEN reports in the worker's zones plus
 * the reports currently assigned to the worker. Read-only.
 */
@Service
public class TaskService {

    private static final Set<ReportStatus> ASSIGNED_STATUSES = EnumSet.of(ReportStatus.ASSIGNED, ReportStatus.IN_PROGRESS);

    private final ReportRepository reportRepository;
    private final WorkerService workerService;
    private final Clock clock;

    public TaskService(ReportRepository reportRepository, WorkerService workerService, Clock clock) {
        this.reportRepository = reportRepository;
        this.workerService = workerService;
        this.clock = clock;
    }

    /**
     * @param statusFilter exact status to keep, or null for all actionable statuses
     * @param workerLocation current worker position for distances, or null
     */
    @Transactional(readOnly = true)
    public List<WorkerTask> listTasks(UUID workerId, ReportStatus statusFilter, GeoLocation workerLocation) {
        Worker worker = workerService.requireActiveWorker(workerId);

        // keyed by id so a report seen by both queries appears once
        Map<UUID, TaskSnapshot> snapshots = new LinkedHashMap<>();
        if (!worker.getAssignedZones().isEmpty()) {
            reportRepository.findByStatusAndAreaInOrderByCreatedAtAsc(ReportStatus.OPEN, worker.getAssignedZones())
                    .forEach(r -> snapshots.putIfAbsent(r.getId(), TaskSnapshot.of(r)));
        }
        reportRepository.findByAssignedWorkerIdAndStatusInOrderByCreatedAtAsc(workerId, ASSIGNED_STATUSES)
                .forEach(r -> snapshots.putIfAbsent(r.getId(), TaskSnapshot.of(r)));

        List<TaskSnapshot> candidates = new ArrayList<>();
        for (TaskSnapshot snapshot : snapshots.values()) {
            if (statusFilter == null || snapshot.status() == statusFilter) {
                candidates.add(snapshot);
            }
        }

        Instant now = clock.instant();
        List<WorkerTask> tasks = new ArrayList<>(candidates.size());
        for (RankedTask ranked : TaskPriority.rank(candidates, now)) {
            tasks.add(toTask(ranked, workerLocation, now));
        }
        return tasks;
    }

    private static WorkerTask toTask(RankedTask ranked, GeoLocation workerLocation, Instant now) {
        TaskSnapshot s = ranked.snapshot();
        Double distance = workerLocation == null
                ? null
                : (double) Math.round(GeoLocation.haversineMeters(
                        workerLocation.getLatitude(), workerLocation.getLongitude(), s.latitude(), s.longitude()));
        return new WorkerTask(
                s.reportId(),
                s.status(),
                s.severity(),
                Math.round(ranked.priority() * 100) / 100.0,
                Math.round(TaskPriority.ageInHours(s.createdAt(), now) * 10) / 10.0,
                distance,
                Severity.orDefault(s.severity()).getEstimatedCleanupMinutes(),
                s.area(),
                s.latitude(),
                s.longitude(),
                s.photoUrl(),
                s.description(),
                s.wasteTypes(),
                s.createdAt());
    }

    public record WorkerTask(
            UUID reportId,
            ReportStatus status,
            Severity severity,
            double priority,
            double ageHours,
            Double distanceMeters,
            int estimatedMinutes,
            String area,
            double latitude,
            double longitude,
            String photoUrl,
            String description,
            Set<String> wasteTypes,
            Instant createdAt
    ) {}
}
