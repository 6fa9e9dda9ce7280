package com.leakmonitor.backend.scan.decision;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.leakmonitor.backend.scan.ai.AssessmentClient;
import com.leakmonitor.backend.scan.ai.RelevanceVerdict;
import com.leakmonitor.backend.scan.ai.RepoProfile;
import com.leakmonitor.backend.scan.config.GitHubProperties;
import com.leakmonitor.backend.scan.config.ScanProperties;
import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.domain.ScanOverride;
import com.leakmonitor.backend.scan.github.GitHubRateLimiter;
import com.leakmonitor.backend.scan.github.RepositoryMetadataClient;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RepoDecisionEngineTest {

  private static final Instant LAST_SCANNED = Instant.parse("2024-04-01T12:00:00Z");

  @Mock private AssessmentClient assessmentClient;
  @Mock private RepositoryMetadataClient metadataClient;

  private RepoDecisionEngine engine;

  @BeforeEach
  void setUp() {
    ScanProperties scanProperties = new ScanProperties();
    scanProperties.setMaxRepoSizeMb(500);
    scanProperties.setRelevanceThreshold(0.30);
    RelevanceGuard relevanceGuard =
        new RelevanceGuard(
            assessmentClient,
            metadataClient,
            new GitHubRateLimiter(60),
            new GitHubProperties(),
            scanProperties,
            new ScanProgressTracker());
    engine =
        new RepoDecisionEngine(
            List.of(
                new DismissedGuard(),
                new OversizeGuard(scanProperties),
                new BlockOverrideGuard(),
                new ForceOverrideGuard(),
                relevanceGuard,
                new UnchangedGuard()));
  }

  @Test
  void guardOrderIsExplicit() {
    assertThat(engine.guardOrder())
        .containsExactly(
            "dismissed", "oversize", "block-override", "force-override", "relevance", "unchanged");
  }

  @Test
  void oversizedRepositoryIsSkippedWithoutCollaboratorCalls() {
    DiscoveredRepo repo = repo("acme/monorepo");
    repo.setRepoSizeKb(600_000L);

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isFalse();
    assertThat(decision.status()).isEqualTo(RepoScanStatus.SKIPPED);
    assertThat(decision.decidedBy()).isEqualTo("oversize");
    verifyNoInteractions(assessmentClient, metadataClient);
  }

  @Test
  void dismissedRepositoryStopsWithoutStatusWrite() {
    DiscoveredRepo repo = repo("acme/old");
    repo.setDismissed(true);
    repo.setRepoSizeKb(600_000L);

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isFalse();
    assertThat(decision.statusToWrite()).isEmpty();
    verifyNoInteractions(assessmentClient, metadataClient);
  }

  @Test
  void blockedPendingRepositoryIsSkipped() {
    DiscoveredRepo repo = repo("acme/blocked");
    repo.setScanOverride(ScanOverride.BLOCK);

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isFalse();
    assertThat(decision.status()).isEqualTo(RepoScanStatus.SKIPPED);
  }

  @Test
  void blockedRepositoryKeepsEarlierVerdict() {
    DiscoveredRepo repo = repo("acme/blocked");
    repo.setScanOverride(ScanOverride.BLOCK);
    repo.setScanStatus(RepoScanStatus.FINDINGS);

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isFalse();
    assertThat(decision.statusToWrite()).isEmpty();
  }

  @Test
  void forceOverrideBypassesRelevanceAndUnchangedChecks() {
    DiscoveredRepo repo = repo("acme/forced");
    repo.setScanOverride(ScanOverride.FORCE_SCAN);
    repo.setLastScanned(LAST_SCANNED);
    repo.setGithubPushedAt("2024-03-01T00:00:00Z");

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isTrue();
    assertThat(decision.forced()).isTrue();
    verifyNoInteractions(assessmentClient, metadataClient);
  }

  @Test
  void lowRelevanceScoreSkipsDeepScanAndStoresVerdict() {
    stubReadme();
    when(assessmentClient.assessRelevance(any())).thenReturn(new RelevanceVerdict(0.25, "tutorial repo"));
    DiscoveredRepo repo = repo("someone/homework");

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isFalse();
    assertThat(decision.status()).isEqualTo(RepoScanStatus.LOW_RELEVANCE);
    assertThat(repo.getAiRelevance()).isEqualTo(0.25);
    assertThat(repo.getAiSummary()).isEqualTo("tutorial repo");
  }

  @Test
  void relevantRepositoryIsDeepScannedAndProfileCarriesReadme() {
    when(metadataClient.fetchReadme(anyString(), anyInt())).thenReturn("# Acme payments");
    when(assessmentClient.assessRelevance(any())).thenReturn(new RelevanceVerdict(0.9, "internal service"));
    DiscoveredRepo repo = repo("acme/payments");
    repo.setDescription("payments backend");

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isTrue();
    ArgumentCaptor<RepoProfile> profile = ArgumentCaptor.forClass(RepoProfile.class);
    verify(assessmentClient).assessRelevance(profile.capture());
    assertThat(profile.getValue().readmeExcerpt()).isEqualTo("# Acme payments");
    assertThat(profile.getValue().description()).isEqualTo("payments backend");
    assertThat(repo.getAiRelevance()).isEqualTo(0.9);
  }

  @Test
  void assessmentFailureMeansScanOnUncertainty() {
    stubReadme();
    when(assessmentClient.assessRelevance(any())).thenThrow(new IllegalStateException("ollama down"));
    DiscoveredRepo repo = repo("acme/api");

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isTrue();
    assertThat(repo.getAiRelevance()).isEqualTo(1.0);
  }

  @Test
  void pushAtExactlyLastScanCountsAsUnchanged() {
    stubRelevant();
    DiscoveredRepo repo = repo("acme/api");
    repo.setLastScanned(LAST_SCANNED);
    repo.setGithubPushedAt("2024-04-01T12:00:00Z");

    RepoDecision decision = engine.decide(repo);

    assertThat(decision.deepScan()).isFalse();
    assertThat(decision.status()).isEqualTo(RepoScanStatus.UNCHANGED);
  }

  @Test
  void pushAfterLastScanIsScanned() {
    stubRelevant();
    DiscoveredRepo repo = repo("acme/api");
    repo.setLastScanned(LAST_SCANNED);
    repo.setGithubPushedAt("2024-04-01T12:00:01Z");

    assertThat(engine.decide(repo).deepScan()).isTrue();
  }

  @Test
  void unreadablePushTimestampMeansScanAnyway() {
    stubRelevant();
    DiscoveredRepo repo = repo("acme/api");
    repo.setLastScanned(LAST_SCANNED);
    repo.setGithubPushedAt("yesterday");

    assertThat(engine.decide(repo).deepScan()).isTrue();
  }

  private void stubReadme() {
    when(metadataClient.fetchReadme(anyString(), anyInt())).thenReturn("");
  }

  private void stubRelevant() {
    stubReadme();
    when(assessmentClient.assessRelevance(any())).thenReturn(new RelevanceVerdict(0.8, "relevant"));
  }

  private static DiscoveredRepo repo(String fullName) {
    DiscoveredRepo repo = new DiscoveredRepo(fullName);
    repo.setRepoSizeKb(1_024L);
    return repo;
  }
}
