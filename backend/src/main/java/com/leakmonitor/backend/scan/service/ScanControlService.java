package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.scan.persistence.DiscoveredRepoRepository;
import com.leakmonitor.backend.scan.persistence.FindingRepository;
import com.leakmonitor.backend.scan.persistence.ScanRepository;
import com.leakmonitor.backend.scan.progress.ProgressSnapshot;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import com.leakmonitor.backend.scan.service.ScanRunGuard.Admission;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Entry points of the control surface. Admission is decided on the caller's thread so a rejected
 * request fails fast; the admitted work then runs on the pipeline executor.
 */
@Service
public class ScanControlService {

  private static final Logger log = LoggerFactory.getLogger(ScanControlService.class);

  private final ScanRunGuard runGuard;
  private final ScanProgressTracker progress;
  private final ScanPipelineService pipelineService;
  private final ScanRecoveryService recoveryService;
  private final ScanRepository scanRepository;
  private final DiscoveredRepoRepository repoRepository;
  private final FindingRepository findingRepository;
  private final ExecutorService executor;
  private final Object admissionLock = new Object();

  public ScanControlService(
      ScanRunGuard runGuard,
      ScanProgressTracker progress,
      ScanPipelineService pipelineService,
      ScanRecoveryService recoveryService,
      ScanRepository scanRepository,
      DiscoveredRepoRepository repoRepository,
      FindingRepository findingRepository,
      @Qualifier("scanPipelineExecutor") ExecutorService executor) {
    this.runGuard = runGuard;
    this.progress = progress;
    this.pipelineService = pipelineService;
    this.recoveryService = recoveryService;
    this.scanRepository = scanRepository;
    this.repoRepository = repoRepository;
    this.findingRepository = findingRepository;
    this.executor = executor;
  }

  public void startScan(ScanTrigger trigger) {
    submit(ScanPipelineService.OPERATION, admission -> pipelineService.run(admission, trigger));
  }

  /** @return {@code false} when no operation holds the run slot */
  public boolean cancel() {
    boolean requested;
    synchronized (admissionLock) {
      requested = runGuard.isHeld() && progress.requestCancel();
    }
    if (requested) {
      log.info("Cancellation requested for {}", runGuard.currentOperation().orElse("scan"));
    }
    return requested;
  }

  public void resumeScan(Long scanId) {
    Scan scan =
        scanRepository
            .findById(scanId)
            .orElseThrow(
                () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Scan not found: " + scanId));
    if (scan.getStatus() == ScanStatus.COMPLETED) {
      throw new ResponseStatusException(
          HttpStatus.CONFLICT, "Scan " + scanId + " already completed");
    }
    submit(ScanRecoveryService.OPERATION_RESUME, admission -> recoveryService.resumeScan(admission, scanId));
  }

  public void rescanFinding(Long findingId) {
    if (!findingRepository.existsById(findingId)) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Finding not found: " + findingId);
    }
    submit(
        ScanRecoveryService.OPERATION_RESCAN,
        admission -> recoveryService.rescanFinding(admission, findingId));
  }

  public void rescanOpenFindings() {
    submit(ScanRecoveryService.OPERATION_RESCAN, recoveryService::rescanOpenFindings);
  }

  public void reassessOpenFindings() {
    submit(ScanRecoveryService.OPERATION_REASSESS, recoveryService::reassessOpenFindings);
  }

  public boolean isRunning() {
    return runGuard.isHeld();
  }

  public Optional<String> currentOperation() {
    return runGuard.currentOperation();
  }

  public ProgressSnapshot progress() {
    return progress.snapshot();
  }

  public Optional<Scan> latestScan() {
    return scanRepository.findFirstByOrderByStartedAtDesc();
  }

  public Map<RepoScanStatus, Long> repoCountsByStatus() {
    Map<RepoScanStatus, Long> counts = new EnumMap<>(RepoScanStatus.class);
    for (RepoScanStatus status : RepoScanStatus.values()) {
      counts.put(status, repoRepository.countByScanStatus(status));
    }
    return counts;
  }

  public long openFindings() {
    return findingRepository.countByResolvedFalse();
  }

  public long totalScans() {
    return scanRepository.count();
  }

  private void submit(String operation, Consumer<Admission> task) {
    Admission admission;
    synchronized (admissionLock) {
      admission =
          runGuard
              .tryAdmit(operation)
              .orElseThrow(
                  () -> new ScanAlreadyRunningException(runGuard.currentOperation().orElse(operation)));
      progress.arm();
    }
    try {
      executor.execute(
          () -> {
            try {
              task.accept(admission);
            } finally {
              admission.close();
            }
          });
    } catch (RejectedExecutionException ex) {
      progress.reset();
      admission.close();
      throw ex;
    }
    log.info("{} submitted", operation);
  }
}
