package com.leakmonitor.backend.scan.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.Keyword;
import com.leakmonitor.backend.scan.domain.KeywordCategory;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.scan.notification.NotificationDispatcher;
import com.leakmonitor.backend.scan.osint.OsintService;
import com.leakmonitor.backend.scan.persistence.DiscoveredRepoRepository;
import com.leakmonitor.backend.scan.persistence.KeywordRepository;
import com.leakmonitor.backend.scan.persistence.ScanRepository;
import com.leakmonitor.backend.scan.progress.CancellationToken;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import com.leakmonitor.backend.scan.service.RepoAnalysisService.RepoOutcome;
import com.leakmonitor.backend.scan.service.ScanRunGuard.Admission;
import com.leakmonitor.backend.support.MutableClock;
import com.leakmonitor.backend.support.TestEntities;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScanPipelineServiceTest {

  private static final long SCAN_ID = 42L;

  @Mock private ScanRepository scanRepository;
  @Mock private KeywordRepository keywordRepository;
  @Mock private DiscoveredRepoRepository repoRepository;
  @Mock private OsintService osintService;
  @Mock private KeywordSearchService keywordSearchService;
  @Mock private RepoAnalysisService repoAnalysisService;
  @Mock private KeywordContextService keywordContextService;
  @Mock private NotificationDispatcher notificationDispatcher;

  private ScanRunGuard runGuard;
  private ScanProgressTracker progress;
  private SimpleMeterRegistry meterRegistry;
  private ScanPipelineService pipeline;
  private final AtomicReference<Scan> savedScan = new AtomicReference<>();

  @BeforeEach
  void setUp() {
    runGuard = new ScanRunGuard();
    progress = new ScanProgressTracker();
    meterRegistry = new SimpleMeterRegistry();
    ScanFinalizer finalizer =
        new ScanFinalizer(
            scanRepository,
            notificationDispatcher,
            progress,
            meterRegistry,
            new MutableClock(Instant.now().plusSeconds(30)));
    pipeline =
        new ScanPipelineService(
            runGuard,
            progress,
            scanRepository,
            keywordRepository,
            repoRepository,
            osintService,
            keywordSearchService,
            repoAnalysisService,
            keywordContextService,
            finalizer);

    lenient()
        .when(scanRepository.save(any(Scan.class)))
        .thenAnswer(
            invocation -> {
              Scan scan = invocation.getArgument(0);
              if (scan.getId() == null) {
                TestEntities.withId(scan, SCAN_ID);
              }
              savedScan.set(scan);
              return scan;
            });
  }

  @Test
  void secondRunIsRejectedWhileSlotIsHeld() {
    Admission running = runGuard.tryAdmit("rescan").orElseThrow();

    ScanRunResult result = pipeline.run(ScanTrigger.MANUAL);

    assertThat(result.admitted()).isFalse();
    assertThat(runGuard.currentOperation()).contains("rescan");
    verifyNoInteractions(scanRepository, keywordRepository);
    running.close();
  }

  @Test
  void noActiveKeywordsCompletesWithZeroCounts() {
    when(keywordRepository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of());

    ScanRunResult result = pipeline.run(ScanTrigger.SCHEDULED);

    assertThat(result.status()).isEqualTo(ScanStatus.COMPLETED);
    Scan scan = savedScan.get();
    assertThat(scan.getKeywordsUsed()).isZero();
    assertThat(scan.getReposFound()).isZero();
    assertThat(scan.getFinishedAt()).isNotNull();
    verifyNoInteractions(osintService, keywordSearchService, repoAnalysisService);
    verify(notificationDispatcher).dispatch(scan);
    assertThat(runGuard.isHeld()).isFalse();
  }

  @Test
  void fullRunTalliesScannedRepositoriesAndCompletes() {
    when(keywordRepository.findByActiveTrueOrderByIdAsc())
        .thenReturn(List.of(new Keyword("acme", KeywordCategory.COMPANY)));
    when(keywordContextService.customPatterns()).thenReturn(List.of());
    when(osintService.expandKeywords(any(), anyList(), any())).thenReturn(List.of("acme.io"));
    when(keywordSearchService.search(anyList(), any())).thenReturn(2);
    DiscoveredRepo scanned = TestEntities.withId(new DiscoveredRepo("acme/api"), 1L);
    DiscoveredRepo known = TestEntities.withId(new DiscoveredRepo("acme/legacy"), 2L);
    DiscoveredRepo skipped = TestEntities.withId(new DiscoveredRepo("acme/huge"), 3L);
    when(repoRepository.findAllByOrderByIdAsc()).thenReturn(List.of(scanned, known, skipped));
    when(repoAnalysisService.analyze(eq(scanned), any(), anyList(), any()))
        .thenReturn(RepoOutcome.scanned(3, 4, RepoScanStatus.FINDINGS));
    when(repoAnalysisService.analyze(eq(known), any(), anyList(), any()))
        .thenReturn(RepoOutcome.scanned(0, 2, RepoScanStatus.FINDINGS));
    when(repoAnalysisService.analyze(eq(skipped), any(), anyList(), any()))
        .thenReturn(RepoOutcome.skipped(RepoScanStatus.SKIPPED));

    ScanRunResult result = pipeline.run(ScanTrigger.MANUAL);

    assertThat(result.admitted()).isTrue();
    assertThat(result.scanId()).isEqualTo(SCAN_ID);
    assertThat(result.status()).isEqualTo(ScanStatus.COMPLETED);
    Scan scan = savedScan.get();
    assertThat(scan.getKeywordsUsed()).isEqualTo(2);
    assertThat(scan.getReposFound()).isEqualTo(2);
    assertThat(scan.getReposScanned()).isEqualTo(2);
    assertThat(scan.getNewFindings()).isEqualTo(3);
    assertThat(scan.getTotalFindings()).isEqualTo(6);
    assertThat(scan.getDurationSeconds()).isGreaterThanOrEqualTo(0.0);
    verify(keywordSearchService).search(eq(List.of("acme", "acme.io")), any());
    verify(notificationDispatcher).dispatch(scan);
    assertThat(meterRegistry.counter("leakmonitor.scan.runs", "status", "COMPLETED", "trigger", "MANUAL").count())
        .isEqualTo(1.0);
    assertThat(runGuard.isHeld()).isFalse();
    assertThat(progress.isRunning()).isFalse();
  }

  @Test
  void cancellationDuringCodeSearchEndsCancelledAndReleasesSlot() {
    when(keywordRepository.findByActiveTrueOrderByIdAsc())
        .thenReturn(List.of(new Keyword("acme", KeywordCategory.GENERAL)));
    when(keywordContextService.customPatterns()).thenReturn(List.of());
    when(osintService.expandKeywords(any(), anyList(), any())).thenReturn(List.of());
    when(keywordSearchService.search(anyList(), any()))
        .thenAnswer(
            invocation -> {
              assertThat(progress.requestCancel()).isTrue();
              CancellationToken token = invocation.getArgument(1);
              token.throwIfCancelled();
              return 0;
            });

    ScanRunResult result = pipeline.run(ScanTrigger.MANUAL);

    assertThat(result.status()).isEqualTo(ScanStatus.CANCELLED);
    Scan scan = savedScan.get();
    assertThat(scan.getStatus()).isEqualTo(ScanStatus.CANCELLED);
    assertThat(scan.getReposScanned()).isZero();
    assertThat(scan.getNewFindings()).isZero();
    assertThat(scan.getFinishedAt()).isNotNull();
    verifyNoInteractions(repoAnalysisService, notificationDispatcher);
    assertThat(runGuard.isHeld()).isFalse();
    assertThat(progress.isRunning()).isFalse();
    assertThat(progress.isCancellationRequested()).isFalse();
  }

  @Test
  void unexpectedErrorMarksScanFailedWithGenericMessage() {
    when(keywordRepository.findByActiveTrueOrderByIdAsc())
        .thenReturn(List.of(new Keyword("acme", KeywordCategory.GENERAL)));
    when(keywordContextService.customPatterns()).thenReturn(List.of());
    when(osintService.expandKeywords(any(), anyList(), any())).thenReturn(List.of());
    when(keywordSearchService.search(anyList(), any())).thenReturn(1);
    when(repoRepository.findAllByOrderByIdAsc()).thenThrow(new IllegalStateException("db gone"));

    ScanRunResult result = pipeline.run(ScanTrigger.MANUAL);

    assertThat(result.status()).isEqualTo(ScanStatus.FAILED);
    Scan scan = savedScan.get();
    assertThat(scan.getErrorMessage()).isEqualTo(ScanFinalizer.PIPELINE_ERROR_MESSAGE);
    assertThat(scan.getFinishedAt()).isNotNull();
    verify(notificationDispatcher, never()).dispatch(any());
    assertThat(runGuard.isHeld()).isFalse();
  }

  @Test
  void admittedRunReleasesCallersAdmission() {
    when(keywordRepository.findByActiveTrueOrderByIdAsc()).thenReturn(List.of());
    Admission admission = runGuard.tryAdmit(ScanPipelineService.OPERATION).orElseThrow();

    pipeline.run(admission, ScanTrigger.MANUAL);

    assertThat(runGuard.isHeld()).isFalse();
  }
}
