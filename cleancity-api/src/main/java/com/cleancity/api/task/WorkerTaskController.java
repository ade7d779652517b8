package com.cleancity.api.task;

import com.cleancity.api.error.ValidationException;
import com.cleancity.api.task.TaskService.WorkerTask;
import com.cleancity.api.verification.VerificationService;
import com.cleancity.api.verification.VerificationService.CompleteResult;
import com.cleancity.api.verification.VerificationService.StartResult;
import com.cleancity.api.verification.VerificationService.StartTaskCommand;
import com.cleancity.core.domain.GeoLocation;
import com.cleancity.core.domain.ReportStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Worker task list and field verification.
 */
@RestController
@RequestMapping("/api/v1/worker/tasks")
public class WorkerTaskController {

    private final TaskService taskService;
    private final VerificationService verificationService;

    public WorkerTaskController(TaskService taskService, VerificationService verificationService) {
        this.taskService = taskService;
        this.verificationService = verificationService;
    }

    @GetMapping
    public ResponseEntity<List<WorkerTask>> listTasks(
            @RequestHeader("X-Worker-Id") UUID workerId,
            @RequestParam(required = false) ReportStatus status,
            @RequestParam(required = false) Double lat,
            @RequestParam(required = false) Double lng) {
        if ((lat == null) != (lng == null)) {
            throw new ValidationException(lat == null ? "lat" : "lng", "lat and lng must be given together");
        }
        GeoLocation location = lat == null ? null : GeoLocation.of(lat, lng);
        if (location != null && (!location.hasValidLatitude() || !location.hasValidLongitude())) {
            throw new ValidationException("lat", "Worker location is out of range");
        }
        return ResponseEntity.ok(taskService.listTasks(workerId, status, location));
    }

    @PostMapping("/{reportId}/start")
    public ResponseEntity<StartResult> start(
            @PathVariable UUID reportId,
            @RequestHeader("X-Worker-Id") UUID workerId,
            @RequestBody StartTaskCommand request) {
        return ResponseEntity.ok(verificationService.startTask(reportId, workerId, request));
    }

    @PostMapping("/{reportId}/complete")
    public ResponseEntity<CompleteResult> complete(
            @PathVariable UUID reportId,
            @RequestHeader("X-Worker-Id") UUID workerId,
            @RequestBody CompleteTaskRequest request) {
        return ResponseEntity.ok(verificationService.completeTask(
                reportId, workerId, request == null ? null : request.afterPhotoUrl()));
    }

    public record CompleteTaskRequest(String afterPhotoUrl) {}
}
