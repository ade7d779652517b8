package com.cleancity.api.approval;

import com.cleancity.api.approval.ApprovalQueryService.ApprovalStats;
import com.cleancity.api.approval.ApprovalQueryService.PendingPage;
import com.cleancity.api.approval.ApprovalQueryService.VerificationDetail;
import com.cleancity.api.approval.ApprovalService.ApprovalResult;
import com.cleancity.api.approval.ApprovalService.RejectionResult;
import com.cleancity.api.error.ValidationException;
import com.cleancity.api.status.ReportStatusService;
import com.cleancity.api.status.ReportStatusService.TransitionResult;
import com.cleancity.api.worker.WorkerService;
import com.cleancity.api.worker.WorkerService.WorkerDto;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Admin operations: assignment, the verification approval queue, and the worker registry.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final ReportStatusService reportStatusService;
    private final ApprovalService approvalService;
    private final ApprovalQueryService approvalQueryService;
    private final WorkerService workerService;

    public AdminController(
            ReportStatusService reportStatusService,
            ApprovalService approvalService,
            ApprovalQueryService approvalQueryService,
            WorkerService workerService) {
        this.reportStatusService = reportStatusService;
        this.approvalService = approvalService;
        this.approvalQueryService = approvalQueryService;
        this.workerService = workerService;
    }

    @PostMapping("/reports/{id}/assign")
    public ResponseEntity<TransitionResult> assign(
            @PathVariable UUID id,
            @RequestHeader("X-Admin-Id") UUID adminId,
            @RequestBody AssignRequest request) {
        if (request == null || request.workerId() == null) {
            throw new ValidationException("workerId", "Worker ID is required");
        }
        return ResponseEntity.ok(reportStatusService.assign(id, request.workerId()));
    }

    @PostMapping("/reports/{id}/unassign")
    public ResponseEntity<TransitionResult> unassign(
            @PathVariable UUID id,
            @RequestHeader("X-Admin-Id") UUID adminId) {
        return ResponseEntity.ok(reportStatusService.unassign(id));
    }

    @GetMapping("/verifications/pending")
    public ResponseEntity<PendingPage> pending(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(approvalQueryService.listPending(page, size));
    }

    @GetMapping("/verifications/stats")
    public ResponseEntity<ApprovalStats> stats() {
        return ResponseEntity.ok(approvalQueryService.stats());
    }

    @GetMapping("/verifications/{id}")
    public ResponseEntity<VerificationDetail> verification(@PathVariable UUID id) {
        return ResponseEntity.ok(approvalQueryService.getVerification(id));
    }

    @PostMapping("/verifications/{id}/approve")
    public ResponseEntity<ApprovalResult> approve(
            @PathVariable UUID id,
            @RequestHeader("X-Admin-Id") UUID adminId) {
        return ResponseEntity.ok(approvalService.approve(id, adminId));
    }

    @PostMapping("/verifications/{id}/reject")
    public ResponseEntity<RejectionResult> reject(
            @PathVariable UUID id,
            @RequestHeader("X-Admin-Id") UUID adminId,
            @RequestBody(required = false) RejectRequest request) {
        return ResponseEntity.ok(approvalService.reject(id, adminId, request == null ? null : request.reason()));
    }

    @PostMapping("/workers")
    public ResponseEntity<WorkerDto> registerWorker(
            @RequestHeader("X-Admin-Id") UUID adminId,
            @RequestBody RegisterWorkerRequest request) {
        if (request == null) {
            throw new ValidationException("body", "Request body is required");
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(workerService.register(request.name(), request.phone(), request.zones()));
    }

    @GetMapping("/workers")
    public ResponseEntity<List<WorkerDto>> listWorkers() {
        return ResponseEntity.ok(workerService.listWorkers());
    }

    @PostMapping("/workers/{id}/deactivate")
    public ResponseEntity<WorkerDto> deactivateWorker(
            @PathVariable UUID id,
            @RequestHeader("X-Admin-Id") UUID adminId) {
        return ResponseEntity.ok(workerService.deactivate(id));
    }

    public record AssignRequest(UUID workerId) {}

    public record RejectRequest(String reason) {}

    public record RegisterWorkerRequest(String name, String phone, Set<String> zones) {}
}
