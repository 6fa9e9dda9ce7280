package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import com.leakmonitor.backend.scan.notification.NotificationDispatcher;
import com.leakmonitor.backend.scan.persistence.ScanRepository;
import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/** Terminal transitions of a scan, shared by the pipeline and scan resumption. */
@Service
public class ScanFinalizer {

  private static final Logger log = LoggerFactory.getLogger(ScanFinalizer.class);

  static final String PIPELINE_ERROR_MESSAGE = "Pipeline error - check logs";

  private final ScanRepository scanRepository;
  private final NotificationDispatcher notificationDispatcher;
  private final ScanProgressTracker progress;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public ScanFinalizer(
      ScanRepository scanRepository,
      NotificationDispatcher notificationDispatcher,
      ScanProgressTracker progress,
      @Nullable MeterRegistry meterRegistry,
      @Nullable Clock clock) {
    this.scanRepository = scanRepository;
    this.notificationDispatcher = notificationDispatcher;
    this.progress = progress;
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /** Stamps the duration, marks the scan completed, then notifies. */
  public Scan complete(Scan scan) {
    scan.finish(ScanStatus.COMPLETED, clock.instant());
    Scan saved = scanRepository.save(scan);
    record(saved);
    progress.activity(
        ActivityType.DONE,
        "Scan #%d completed: %d repos scanned, %d new findings"
            .formatted(saved.getId(), saved.getReposScanned(), saved.getNewFindings()));
    log.info(
        "Scan {} completed in {}s: {} repos found, {} scanned, {} new findings",
        saved.getId(),
        saved.getDurationSeconds(),
        saved.getReposFound(),
        saved.getReposScanned(),
        saved.getNewFindings());
    notificationDispatcher.dispatch(saved);
    return saved;
  }

  /** Keeps the counts reached so far. */
  public Scan cancel(Scan scan) {
    scan.finish(ScanStatus.CANCELLED, clock.instant());
    Scan saved = scanRepository.save(scan);
    record(saved);
    progress.activity(ActivityType.CANCEL, "Scan #%d cancelled".formatted(saved.getId()));
    log.info("Scan {} cancelled after {} repos", saved.getId(), saved.getReposScanned());
    return saved;
  }

  public Scan fail(Scan scan) {
    scan.setErrorMessage(PIPELINE_ERROR_MESSAGE);
    scan.finish(ScanStatus.FAILED, clock.instant());
    Scan saved = scanRepository.save(scan);
    record(saved);
    progress.activity(ActivityType.ERROR, "Scan #%d failed".formatted(saved.getId()));
    return saved;
  }

  private void record(Scan scan) {
    meterRegistry
        .counter(
            "leakmonitor.scan.runs",
            "status",
            scan.getStatus().name(),
            "trigger",
            scan.getTrigger().name())
        .increment();
    if (scan.getDurationSeconds() != null) {
      meterRegistry
          .timer("leakmonitor.scan.duration", "status", scan.getStatus().name())
          .record(Duration.ofMillis(Math.round(scan.getDurationSeconds() * 1000)));
    }
    if (scan.getNewFindings() > 0) {
      meterRegistry.counter("leakmonitor.scan.findings.new").increment(scan.getNewFindings());
    }
  }
}
