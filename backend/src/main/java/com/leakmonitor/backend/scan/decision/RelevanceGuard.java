package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.ai.AssessmentClient;
import com.leakmonitor.backend.scan.ai.RelevanceVerdict;
import com.leakmonitor.backend.scan.ai.RepoProfile;
import com.leakmonitor.backend.scan.config.GitHubProperties;
import com.leakmonitor.backend.scan.config.ScanProperties;
import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.github.GitHubRateLimiter;
import com.leakmonitor.backend.scan.github.RepositoryMetadataClient;
import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Asks the AI collaborator whether the repository is worth a deep scan. The score and summary are
 * stored on the repository whatever the outcome; any failure counts as a score of 1.0.
 */
@Component
@Order(50)
public class RelevanceGuard implements RepoDecisionGuard {

  private static final Logger log = LoggerFactory.getLogger(RelevanceGuard.class);

  private final AssessmentClient assessmentClient;
  private final RepositoryMetadataClient metadataClient;
  private final GitHubRateLimiter rateLimiter;
  private final GitHubProperties gitHubProperties;
  private final ScanProperties scanProperties;
  private final ScanProgressTracker progress;

  public RelevanceGuard(
      AssessmentClient assessmentClient,
      RepositoryMetadataClient metadataClient,
      GitHubRateLimiter rateLimiter,
      GitHubProperties gitHubProperties,
      ScanProperties scanProperties,
      ScanProgressTracker progress) {
    this.assessmentClient = assessmentClient;
    this.metadataClient = metadataClient;
    this.rateLimiter = rateLimiter;
    this.gitHubProperties = gitHubProperties;
    this.scanProperties = scanProperties;
    this.progress = progress;
  }

  @Override
  public String name() {
    return "relevance";
  }

  @Override
  public GuardVerdict evaluate(DiscoveredRepo repo, boolean forced) {
    if (forced) {
      return GuardVerdict.proceed();
    }
    RelevanceVerdict verdict;
    try {
      verdict = assessmentClient.assessRelevance(profileOf(repo));
    } catch (RuntimeException ex) {
      log.warn("Relevance check failed for {}, scanning anyway: {}", repo.getFullName(), ex.getMessage());
      verdict = RelevanceVerdict.scanOnUncertainty("AI unavailable");
    }
    repo.setAiRelevance(verdict.score());
    repo.setAiSummary(verdict.summary());
    progress.activity(
        ActivityType.AI, "Relevance %.2f for %s".formatted(verdict.score(), repo.getFullName()));
    if (verdict.score() < scanProperties.getRelevanceThreshold()) {
      return GuardVerdict.stop(RepoScanStatus.LOW_RELEVANCE);
    }
    return GuardVerdict.proceed();
  }

  private RepoProfile profileOf(DiscoveredRepo repo) {
    String readme = "";
    if (rateLimiter.acquire(gitHubProperties.getReadmeAcquireTimeout())) {
      readme = metadataClient.fetchReadme(repo.getFullName(), gitHubProperties.getReadmeMaxChars());
    } else {
      log.debug("No rate limit token for README of {}", repo.getFullName());
    }
    return new RepoProfile(
        repo.getFullName(),
        repo.getDescription(),
        repo.getLanguage(),
        readme,
        repo.getMatchedKeywords());
  }
}
