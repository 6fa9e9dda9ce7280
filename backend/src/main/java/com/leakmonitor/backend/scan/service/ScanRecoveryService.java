package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.Finding;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import com.leakmonitor.backend.scan.persistence.DiscoveredRepoRepository;
import com.leakmonitor.backend.scan.persistence.FindingRepository;
import com.leakmonitor.backend.scan.persistence.ScanRepository;
import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.CancellationToken;
import com.leakmonitor.backend.scan.progress.PipelineStage;
import com.leakmonitor.backend.scan.progress.ScanCancelledException;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import com.leakmonitor.backend.scan.scanner.CustomPattern;
import com.leakmonitor.backend.scan.scanner.DeepScanReport;
import com.leakmonitor.backend.scan.scanner.DeepScanService;
import com.leakmonitor.backend.scan.scanner.RawFinding;
import com.leakmonitor.backend.scan.service.RepoAnalysisService.RepoOutcome;
import com.leakmonitor.backend.scan.service.ScanRunGuard.Admission;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Repairs and re-verification: stale scan cleanup, resuming the analysis stage of an interrupted
 * scan, re-scanning open findings and re-running their assessment. Every operation shares the
 * single run slot with the pipeline.
 */
@Service
public class ScanRecoveryService {

  private static final Logger log = LoggerFactory.getLogger(ScanRecoveryService.class);

  public static final String STALE_SCAN_MESSAGE = "Scan interrupted - process restarted";
  static final String AUTO_RESOLVE_NOTE = "Auto-resolved: not found in rescan (%s)";

  public static final String OPERATION_CLEANUP = "stale-cleanup";
  public static final String OPERATION_RESUME = "resume";
  public static final String OPERATION_RESCAN = "rescan";
  public static final String OPERATION_REASSESS = "reassess";

  private final ScanRunGuard runGuard;
  private final ScanProgressTracker progress;
  private final ScanRepository scanRepository;
  private final DiscoveredRepoRepository repoRepository;
  private final FindingRepository findingRepository;
  private final RepoAnalysisService repoAnalysisService;
  private final DeepScanService deepScanService;
  private final RepoScanRecorder recorder;
  private final FindingAssessmentService assessmentService;
  private final KeywordContextService keywordContextService;
  private final ScanFinalizer finalizer;
  private final Clock clock;

  public ScanRecoveryService(
      ScanRunGuard runGuard,
      ScanProgressTracker progress,
      ScanRepository scanRepository,
      DiscoveredRepoRepository repoRepository,
      FindingRepository findingRepository,
      RepoAnalysisService repoAnalysisService,
      DeepScanService deepScanService,
      RepoScanRecorder recorder,
      FindingAssessmentService assessmentService,
      KeywordContextService keywordContextService,
      ScanFinalizer finalizer,
      @Nullable Clock clock) {
    this.runGuard = runGuard;
    this.progress = progress;
    this.scanRepository = scanRepository;
    this.repoRepository = repoRepository;
    this.findingRepository = findingRepository;
    this.repoAnalysisService = repoAnalysisService;
    this.deepScanService = deepScanService;
    this.recorder = recorder;
    this.assessmentService = assessmentService;
    this.keywordContextService = keywordContextService;
    this.finalizer = finalizer;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /**
   * Fails every scan left {@code RUNNING} by a previous process.
   *
   * @return number of scans repaired
   */
  public int cleanupStaleScans() {
    Optional<Admission> admission = runGuard.tryAdmit(OPERATION_CLEANUP);
    if (admission.isEmpty()) {
      log.info("Stale scan cleanup skipped: {} is running", runGuard.currentOperation().orElse("?"));
      return 0;
    }
    try {
      List<Scan> stale = scanRepository.findByStatus(ScanStatus.RUNNING);
      Instant now = clock.instant();
      for (Scan scan : stale) {
        scan.setErrorMessage(STALE_SCAN_MESSAGE);
        scan.finish(ScanStatus.FAILED, now);
        scanRepository.save(scan);
        log.warn("Scan {} was left running by a previous process, marked failed", scan.getId());
      }
      return stale.size();
    } finally {
      admission.get().close();
    }
  }

  /** Re-runs the analysis stage over pending repositories, then finalizes the scan. */
  public Optional<ScanStatus> resumeScan(Admission admission, Long scanId) {
    Scan scan = null;
    try {
      Optional<Scan> found = scanRepository.findById(scanId);
      if (found.isEmpty()) {
        log.warn("Cannot resume scan {}: not found", scanId);
        return Optional.empty();
      }
      scan = found.get();
      scan.reopen(clock.instant());
      scanRepository.save(scan);
      progress.start(scan.getId());
      progress.activity(ActivityType.START, "Resuming scan #%d".formatted(scanId));
      log.info("Resuming scan {}", scanId);
      return Optional.of(resume(scan, progress).getStatus());
    } catch (ScanCancelledException ex) {
      log.info("Resumed scan {} cancelled by request", scanId);
      return Optional.of(finalizer.cancel(scan).getStatus());
    } catch (RuntimeException ex) {
      log.error("Resuming scan {} failed", scanId, ex);
      if (scan == null) {
        return Optional.empty();
      }
      try {
        return Optional.of(finalizer.fail(scan).getStatus());
      } catch (RuntimeException nested) {
        log.error("Could not mark scan {} as failed", scanId, nested);
        return Optional.of(ScanStatus.FAILED);
      }
    } finally {
      progress.reset();
      admission.close();
    }
  }

  private Scan resume(Scan scan, CancellationToken token) {
    List<CustomPattern> patterns = keywordContextService.customPatterns();
    List<DiscoveredRepo> pending =
        repoRepository.findByScanStatusAndDismissedFalseOrderByIdAsc(RepoScanStatus.PENDING);
    progress.stage(
        PipelineStage.REPO_ANALYSIS, "Resuming %d pending repositories".formatted(pending.size()));
    int index = 0;
    for (DiscoveredRepo repo : pending) {
      token.throwIfCancelled();
      index++;
      progress.progress(index, pending.size(), repo.getFullName());
      RepoOutcome outcome;
      try {
        outcome = repoAnalysisService.analyze(repo, scan, patterns, token);
      } catch (ScanCancelledException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        log.warn("Skipping {} after analysis failure: {}", repo.getFullName(), ex.getMessage());
        progress.activity(ActivityType.ERROR, "Skipped %s".formatted(repo.getFullName()));
        recorder.recordDecision(repo, RepoScanStatus.SKIPPED);
        continue;
      }
      if (outcome.scanned()) {
        scan.setReposScanned(scan.getReposScanned() + 1);
        scan.setNewFindings(scan.getNewFindings() + outcome.newFindings());
        scan.setTotalFindings(scan.getTotalFindings() + outcome.totalFindings());
        scanRepository.save(scan);
        progress.repoScanned();
        progress.addFindings(outcome.newFindings());
      }
    }
    token.throwIfCancelled();
    progress.stage(PipelineStage.FINALIZE, "Finalizing");
    return finalizer.complete(scan);
  }

  /** Re-scans the finding's repository and settles the finding. Never throws. */
  public RescanOutcome rescanFinding(Admission admission, Long findingId) {
    try {
      progress.start(null);
      Optional<Finding> found = findingRepository.findWithRepoById(findingId);
      if (found.isEmpty()) {
        return RescanOutcome.NOT_FOUND;
      }
      Finding finding = found.get();
      if (finding.isResolved()) {
        return RescanOutcome.ALREADY_RESOLVED;
      }
      DiscoveredRepo repo = finding.getRepo();
      progress.activity(ActivityType.START, "Rescanning finding #%d".formatted(findingId));
      DeepScanReport report =
          deepScanService.scan(repo.getFullName(), keywordContextService.customPatterns(), progress);
      RescanOutcome outcome = settle(finding, repo, report, index(report, repo));
      recorder.refreshFindingStatus(repo.getId());
      log.info("Rescan of finding {} in {}: {}", findingId, repo.getFullName(), outcome);
      return outcome;
    } catch (RuntimeException ex) {
      log.warn("Rescan of finding {} failed", findingId, ex);
      return RescanOutcome.FAILED;
    } finally {
      progress.reset();
      admission.close();
    }
  }

  /** Re-scans every repository with open findings once, then settles each finding. */
  public RescanSummary rescanOpenFindings(Admission admission) {
    List<RescanOutcome> outcomes = new ArrayList<>();
    int repositories = 0;
    try {
      progress.start(null);
      Map<Long, List<Finding>> byRepo = new LinkedHashMap<>();
      for (Finding finding : findingRepository.findOpenWithRepo()) {
        byRepo.computeIfAbsent(finding.getRepo().getId(), id -> new ArrayList<>()).add(finding);
      }
      List<CustomPattern> patterns = keywordContextService.customPatterns();
      progress.stage(
          PipelineStage.REPO_ANALYSIS, "Rescanning %d repositories".formatted(byRepo.size()));
      for (List<Finding> findings : byRepo.values()) {
        progress.checkCancelled();
        DiscoveredRepo repo = findings.get(0).getRepo();
        repositories++;
        progress.progress(repositories, byRepo.size(), repo.getFullName());
        DeepScanReport report;
        try {
          report = deepScanService.scan(repo.getFullName(), patterns, progress);
        } catch (ScanCancelledException ex) {
          throw ex;
        } catch (RuntimeException ex) {
          log.warn("Rescan of {} failed: {}", repo.getFullName(), ex.getMessage());
          findings.forEach(finding -> outcomes.add(RescanOutcome.FAILED));
          continue;
        }
        Map<String, RawFinding> present = index(report, repo);
        for (Finding finding : findings) {
          outcomes.add(settle(finding, repo, report, present));
        }
        recorder.refreshFindingStatus(repo.getId());
      }
      progress.activity(ActivityType.DONE, "Rescanned %d repositories".formatted(repositories));
    } catch (ScanCancelledException ex) {
      log.info("Rescan of open findings cancelled after {} repositories", repositories);
      progress.activity(ActivityType.CANCEL, "Rescan cancelled");
    } catch (RuntimeException ex) {
      log.error("Rescan of open findings failed", ex);
    } finally {
      progress.reset();
      admission.close();
    }
    RescanSummary summary = RescanSummary.of(repositories, outcomes);
    log.info("Rescan of open findings finished: {}", summary.outcomes());
    return summary;
  }

  /**
   * Re-runs the finding assessment for every open finding without scanning.
   *
   * @return number of findings that received a new assessment
   */
  public int reassessOpenFindings(Admission admission) {
    int reassessed = 0;
    try {
      progress.start(null);
      List<Finding> open = findingRepository.findOpenWithRepo();
      progress.stage(PipelineStage.REPO_ANALYSIS, "Reassessing %d findings".formatted(open.size()));
      int index = 0;
      for (Finding finding : open) {
        progress.checkCancelled();
        index++;
        progress.progress(index, open.size(), finding.getRepo().getFullName());
        if (assessmentService.assess(finding, finding.getRepo())) {
          reassessed++;
        }
      }
      progress.activity(ActivityType.DONE, "Reassessed %d findings".formatted(reassessed));
    } catch (ScanCancelledException ex) {
      log.info("Reassessment cancelled after {} findings", reassessed);
      progress.activity(ActivityType.CANCEL, "Reassessment cancelled");
    } catch (RuntimeException ex) {
      log.error("Reassessment of open findings failed", ex);
    } finally {
      progress.reset();
      admission.close();
    }
    return reassessed;
  }

  private RescanOutcome settle(
      Finding finding, DiscoveredRepo repo, DeepScanReport report, Map<String, RawFinding> present) {
    Instant now = clock.instant();
    RawFinding match = present.get(finding.getFindingHash());
    if (match != null) {
      recorder.confirmFinding(finding.getId(), match.snippet(), now);
      if (match.snippet() != null && !match.snippet().isBlank()) {
        finding.setMatchedSnippet(match.snippet());
      }
      assessmentService.assess(finding, repo);
      return RescanOutcome.CONFIRMED;
    }
    if (!report.workingTreeScanned() && deepScanService.requiresWorkingTree(finding.getScanner())) {
      return RescanOutcome.KEPT_OPEN;
    }
    recorder.resolveFinding(
        finding.getId(), AUTO_RESOLVE_NOTE.formatted(LocalDate.ofInstant(now, ZoneOffset.UTC)), now);
    progress.activity(
        ActivityType.FINDING,
        "Resolved %s in %s".formatted(finding.getDetectorName(), repo.getFullName()));
    return RescanOutcome.RESOLVED;
  }

  private static Map<String, RawFinding> index(DeepScanReport report, DiscoveredRepo repo) {
    Map<String, RawFinding> byHash = new LinkedHashMap<>();
    for (RawFinding raw : report.findings()) {
      byHash.putIfAbsent(raw.identity(repo.getFullName()), raw);
    }
    return byHash;
  }
}
