package com.leakmonitor.backend.scan.controller;

import com.leakmonitor.backend.scan.api.ScanAcceptedResponse;
import com.leakmonitor.backend.scan.api.ScanCancelResponse;
import com.leakmonitor.backend.scan.api.ScanResponse;
import com.leakmonitor.backend.scan.api.ScanStatusResponse;
import com.leakmonitor.backend.scan.api.ScanSummaryResponse;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.scan.progress.ProgressSnapshot;
import com.leakmonitor.backend.scan.service.ScanControlService;
import com.leakmonitor.backend.scan.service.ScanPipelineService;
import com.leakmonitor.backend.scan.service.ScanRecoveryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scans")
@Tag(name = "Scans", description = "Start, cancel, resume and observe scan runs.")
public class ScanControlController {

  private final ScanControlService scanControlService;

  public ScanControlController(ScanControlService scanControlService) {
    this.scanControlService = scanControlService;
  }

  @PostMapping("/run")
  @Operation(summary = "Queue a manual scan run.")
  @ApiResponse(responseCode = "202", description = "Run admitted.")
  @ApiResponse(responseCode = "409", description = "Another operation holds the run slot.")
  public ResponseEntity<ScanAcceptedResponse> run() {
    scanControlService.startScan(ScanTrigger.MANUAL);
    return accepted(ScanPipelineService.OPERATION);
  }

  @PostMapping("/cancel")
  @Operation(summary = "Request cooperative cancellation of the running operation.")
  public ScanCancelResponse cancel() {
    return new ScanCancelResponse(scanControlService.cancel());
  }

  @GetMapping("/status")
  public ScanStatusResponse status() {
    return new ScanStatusResponse(
        scanControlService.isRunning(),
        scanControlService.currentOperation().orElse(null),
        scanControlService.latestScan().map(ScanResponse::from).orElse(null));
  }

  @GetMapping("/progress")
  @Operation(summary = "Live stage, counters, log tail and activity feed.")
  public ProgressSnapshot progress() {
    return scanControlService.progress();
  }

  @PostMapping("/{scanId}/resume")
  @Operation(summary = "Resume an interrupted scan over its still pending repositories.")
  @ApiResponse(responseCode = "202", description = "Resume admitted.")
  @ApiResponse(responseCode = "404", description = "Unknown scan.")
  @ApiResponse(responseCode = "409", description = "Scan already completed, or the run slot is held.")
  public ResponseEntity<ScanAcceptedResponse> resume(@PathVariable Long scanId) {
    scanControlService.resumeScan(scanId);
    return accepted(ScanRecoveryService.OPERATION_RESUME);
  }

  @PostMapping("/findings/{findingId}/rescan")
  @Operation(summary = "Deep-scan the repository of one finding again and settle the finding.")
  public ResponseEntity<ScanAcceptedResponse> rescanFinding(@PathVariable Long findingId) {
    scanControlService.rescanFinding(findingId);
    return accepted(ScanRecoveryService.OPERATION_RESCAN);
  }

  @PostMapping("/findings/rescan")
  public ResponseEntity<ScanAcceptedResponse> rescanOpenFindings() {
    scanControlService.rescanOpenFindings();
    return accepted(ScanRecoveryService.OPERATION_RESCAN);
  }

  @PostMapping("/findings/reassess")
  @Operation(summary = "Ask the model again for every open finding.")
  public ResponseEntity<ScanAcceptedResponse> reassessOpenFindings() {
    scanControlService.reassessOpenFindings();
    return accepted(ScanRecoveryService.OPERATION_REASSESS);
  }

  @GetMapping("/summary")
  public ScanSummaryResponse summary() {
    return new ScanSummaryResponse(
        scanControlService.totalScans(),
        scanControlService.openFindings(),
        scanControlService.repoCountsByStatus());
  }

  private static ResponseEntity<ScanAcceptedResponse> accepted(String operation) {
    return ResponseEntity.accepted().body(ScanAcceptedResponse.accepted(operation));
  }
}
