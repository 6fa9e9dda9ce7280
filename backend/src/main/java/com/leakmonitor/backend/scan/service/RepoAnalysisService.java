package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.decision.RepoDecision;
import com.leakmonitor.backend.scan.decision.RepoDecisionEngine;
import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.Finding;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.CancellationToken;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import com.leakmonitor.backend.scan.scanner.CustomPattern;
import com.leakmonitor.backend.scan.scanner.DeepScanReport;
import com.leakmonitor.backend.scan.scanner.DeepScanService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Analysis of one repository: decision chain, deep scan, finding upsert and triage. Shared by the
 * pipeline and by scan resumption.
 */
@Service
public class RepoAnalysisService {

  private static final Logger log = LoggerFactory.getLogger(RepoAnalysisService.class);

  private final RepoDecisionEngine decisionEngine;
  private final DeepScanService deepScanService;
  private final RepoScanRecorder recorder;
  private final FindingAssessmentService assessmentService;
  private final ScanProgressTracker progress;
  private final Clock clock;

  public RepoAnalysisService(
      RepoDecisionEngine decisionEngine,
      DeepScanService deepScanService,
      RepoScanRecorder recorder,
      FindingAssessmentService assessmentService,
      ScanProgressTracker progress,
      @Nullable Clock clock) {
    this.decisionEngine = decisionEngine;
    this.deepScanService = deepScanService;
    this.recorder = recorder;
    this.assessmentService = assessmentService;
    this.progress = progress;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  public RepoOutcome analyze(
      DiscoveredRepo repo, Scan scan, List<CustomPattern> extraPatterns, CancellationToken token) {
    RepoDecision decision = decisionEngine.decide(repo);
    if (!decision.deepScan()) {
      if (decision.status() != null) {
        recorder.recordDecision(repo, decision.status());
        progress.log("  %s -> %s (%s)".formatted(repo.getFullName(), decision.status(), decision.decidedBy()));
      }
      return RepoOutcome.skipped(decision.status());
    }

    Instant started = clock.instant();
    DeepScanReport report = deepScanService.scan(repo.getFullName(), extraPatterns, token);
    Instant finished = clock.instant();
    double seconds = Math.max(0L, Duration.between(started, finished).toMillis()) / 1000.0;

    List<Finding> created =
        recorder.recordScanResult(repo, scan, report.findings(), finished, seconds);
    if (!created.isEmpty()) {
      progress.activity(
          ActivityType.FINDING, "%d new findings in %s".formatted(created.size(), repo.getFullName()));
    }
    for (Finding finding : created) {
      assessmentService.assess(finding, repo);
    }
    log.debug(
        "{} scanned in {}s: {} raw hits, {} new findings",
        repo.getFullName(),
        seconds,
        report.findings().size(),
        created.size());
    return RepoOutcome.scanned(created.size(), report.findings().size(), repo.getScanStatus());
  }

  /**
   * @param newFindings findings recorded for the first time
   * @param totalFindings every detection the deep scan reported, known ones included
   */
  public record RepoOutcome(
      boolean scanned, int newFindings, int totalFindings, @Nullable RepoScanStatus status) {

    static RepoOutcome skipped(@Nullable RepoScanStatus status) {
      return new RepoOutcome(false, 0, 0, status);
    }

    static RepoOutcome scanned(int newFindings, int totalFindings, RepoScanStatus status) {
      return new RepoOutcome(true, newFindings, totalFindings, status);
    }
  }
}
