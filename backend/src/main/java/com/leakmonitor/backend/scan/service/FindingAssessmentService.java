package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.ai.AssessmentClient;
import com.leakmonitor.backend.scan.ai.FindingContext;
import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.Finding;
import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FindingAssessmentService {

  private static final Logger log = LoggerFactory.getLogger(FindingAssessmentService.class);

  private final AssessmentClient assessmentClient;
  private final KeywordContextService keywordContextService;
  private final RepoScanRecorder recorder;
  private final ScanProgressTracker progress;

  public FindingAssessmentService(
      AssessmentClient assessmentClient,
      KeywordContextService keywordContextService,
      RepoScanRecorder recorder,
      ScanProgressTracker progress) {
    this.assessmentClient = assessmentClient;
    this.keywordContextService = keywordContextService;
    this.recorder = recorder;
    this.progress = progress;
  }

  /**
   * Asks for an assessment and stores it. An empty answer leaves the stored text unchanged.
   *
   * @return whether a new assessment was stored
   */
  public boolean assess(Finding finding, DiscoveredRepo repo) {
    FindingContext context =
        new FindingContext(
            repo.getFullName(),
            repo.getDescription(),
            finding.getScanner(),
            finding.getDetectorName(),
            finding.isVerified(),
            finding.getFilePath(),
            finding.getLineNumber(),
            finding.getSeverity() == null ? null : finding.getSeverity().name(),
            finding.getMatchedSnippet(),
            keywordContextService.describeMatches(repo.getId()),
            keywordContextService.operatorInstruction());
    String assessment;
    try {
      assessment = assessmentClient.assessFinding(context);
    } catch (RuntimeException ex) {
      log.warn("Assessment of finding {} failed: {}", finding.getId(), ex.getMessage());
      return false;
    }
    if (assessment == null || assessment.isBlank()) {
      return false;
    }
    recorder.recordAssessment(finding.getId(), assessment);
    progress.activity(
        ActivityType.AI, "Assessed %s in %s".formatted(finding.getDetectorName(), repo.getFullName()));
    return true;
  }
}
