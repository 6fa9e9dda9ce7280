package com.leakmonitor.backend.scan.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.scan.persistence.DiscoveredRepoRepository;
import com.leakmonitor.backend.scan.persistence.FindingRepository;
import com.leakmonitor.backend.scan.persistence.ScanRepository;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import com.leakmonitor.backend.scan.service.ScanRunGuard.Admission;
import com.leakmonitor.backend.support.TestEntities;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class ScanControlServiceTest {

  @Mock private ScanPipelineService pipelineService;
  @Mock private ScanRecoveryService recoveryService;
  @Mock private ScanRepository scanRepository;
  @Mock private DiscoveredRepoRepository repoRepository;
  @Mock private FindingRepository findingRepository;
  @Mock private ExecutorService executor;

  private ScanRunGuard runGuard;
  private ScanProgressTracker progress;
  private ScanControlService service;

  @BeforeEach
  void setUp() {
    runGuard = new ScanRunGuard();
    progress = new ScanProgressTracker();
    service =
        new ScanControlService(
            runGuard,
            progress,
            pipelineService,
            recoveryService,
            scanRepository,
            repoRepository,
            findingRepository,
            executor);
  }

  @Test
  void admittedRunHoldsSlotUntilTaskFinishes() {
    service.startScan(ScanTrigger.MANUAL);

    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(executor).execute(task.capture());
    assertThat(runGuard.currentOperation()).contains(ScanPipelineService.OPERATION);
    assertThatThrownBy(service::reassessOpenFindings)
        .isInstanceOf(ScanAlreadyRunningException.class)
        .extracting("runningOperation")
        .isEqualTo(ScanPipelineService.OPERATION);

    task.getValue().run();

    verify(pipelineService).run(any(Admission.class), eq(ScanTrigger.MANUAL));
    assertThat(runGuard.isHeld()).isFalse();
  }

  @Test
  void rejectedSubmissionReleasesSlot() {
    willThrow(new RejectedExecutionException("shut down")).given(executor).execute(any());

    assertThatThrownBy(() -> service.startScan(ScanTrigger.SCHEDULED))
        .isInstanceOf(RejectedExecutionException.class);

    assertThat(runGuard.isHeld()).isFalse();
  }

  @Test
  void resumeOfUnknownScanIsNotFound() {
    when(scanRepository.findById(8L)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.resumeScan(8L))
        .isInstanceOf(ResponseStatusException.class)
        .extracting(ex -> ((ResponseStatusException) ex).getStatusCode())
        .isEqualTo(HttpStatus.NOT_FOUND);
    verifyNoInteractions(executor);
  }

  @Test
  void resumeOfCompletedScanIsRefused() {
    Scan scan = TestEntities.withId(new Scan(ScanTrigger.MANUAL), 8L);
    scan.finish(ScanStatus.COMPLETED, Instant.now());
    when(scanRepository.findById(8L)).thenReturn(Optional.of(scan));

    assertThatThrownBy(() -> service.resumeScan(8L))
        .isInstanceOf(ResponseStatusException.class)
        .extracting(ex -> ((ResponseStatusException) ex).getStatusCode())
        .isEqualTo(HttpStatus.CONFLICT);
    assertThat(runGuard.isHeld()).isFalse();
  }

  @Test
  void resumeOfFailedScanRunsRecovery() {
    Scan scan = TestEntities.withId(new Scan(ScanTrigger.MANUAL), 8L);
    scan.finish(ScanStatus.FAILED, Instant.now());
    when(scanRepository.findById(8L)).thenReturn(Optional.of(scan));

    service.resumeScan(8L);

    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(executor).execute(task.capture());
    task.getValue().run();
    verify(recoveryService).resumeScan(any(Admission.class), eq(8L));
  }

  @Test
  void cancelWithNothingRunningIsNoop() {
    assertThat(service.cancel()).isFalse();
    assertThat(progress.isCancellationRequested()).isFalse();
  }

  @Test
  void cancelBetweenAdmissionAndStartIsCarriedIntoTheRun() {
    service.startScan(ScanTrigger.MANUAL);

    assertThat(service.cancel()).isTrue();
    assertThat(progress.snapshot().running()).isFalse();

    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    verify(executor).execute(task.capture());
    progress.start(5L);
    assertThat(progress.isCancellationRequested()).isTrue();
  }

  @Test
  void rejectedSubmissionDisarmsTracker() {
    willThrow(new RejectedExecutionException("shut down")).given(executor).execute(any(Runnable.class));

    assertThatThrownBy(() -> service.startScan(ScanTrigger.MANUAL))
        .isInstanceOf(RejectedExecutionException.class);
    assertThat(service.cancel()).isFalse();
    assertThat(progress.requestCancel()).isFalse();
  }
}
