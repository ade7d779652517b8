package com.cleancity.api.report;

import com.cleancity.api.admission.AdmissionControlService;
import com.cleancity.api.admission.AdmissionControlService.SubmissionResult;
import com.cleancity.api.admission.ReportSubmission;
import com.cleancity.api.error.ValidationException;
import com.cleancity.api.report.ReportQueryService.ReportView;
import com.cleancity.core.domain.Severity;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Citizen report submission and reads.
 */
@RestController
@RequestMapping("/api/v1/reports")
public class ReportController {

    private final AdmissionControlService admissionControlService;
    private final ReportQueryService reportQueryService;

    public ReportController(AdmissionControlService admissionControlService, ReportQueryService reportQueryService) {
        this.admissionControlService = admissionControlService;
        this.reportQueryService = reportQueryService;
    }

    /**
     * Submit a report.
     * POST /api/v1/reports
     */
    @PostMapping
    public ResponseEntity<SubmissionResult> submit(
            @RequestHeader("X-Device-Id") String deviceId,
            @RequestBody SubmitReportRequest request) {
        if (request == null) {
            throw new ValidationException("body", "Request body is required");
        }
        SubmissionResult result = admissionControlService.submitReport(new ReportSubmission(
                deviceId,
                request.latitude(),
                request.longitude(),
                request.accuracy(),
                request.photoUrl(),
                request.timestamp(),
                request.description(),
                request.severity(),
                request.wasteTypes(),
                request.area()));
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ReportView> getReport(@PathVariable UUID id) {
        return ResponseEntity.ok(reportQueryService.getReport(id));
    }

    @GetMapping
    public ResponseEntity<List<ReportView>> listReports(@RequestParam String deviceId) {
        return ResponseEntity.ok(reportQueryService.listByDevice(deviceId));
    }

    public record SubmitReportRequest(
            Double latitude,
            Double longitude,
            Double accuracy,
            String photoUrl,
            Instant timestamp,
            String description,
            Severity severity,
            Set<String> wasteTypes,
            String area
    ) {}
}
