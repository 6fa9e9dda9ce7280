package com.leakmonitor.backend.scan.progress;

import com.leakmonitor.backend.scan.progress.ProgressSnapshot.ActivityEntry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Live state of the active pipeline run, shared between the background worker and status readers.
 *
 * <p>Every field is read and written under one lock. The activity feed survives {@link #reset()} so
 * the last notable events stay visible between runs.
 */
@Component
public class ScanProgressTracker implements CancellationToken {

  private static final Logger log = LoggerFactory.getLogger(ScanProgressTracker.class);

  static final int MAX_LOG_LINES = 200;
  static final int MAX_ACTIVITIES = 20;

  private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

  private final ReentrantLock lock = new ReentrantLock();
  private final Clock clock;
  private final Deque<String> logLines = new ArrayDeque<>();
  private final Deque<ActivityEntry> activities = new ArrayDeque<>();

  private boolean armed;
  private boolean running;
  private Long scanId;
  private PipelineStage stage;
  private String message = "";
  private String currentItem = "";
  private int progressCurrent;
  private int progressTotal;
  private int findingsSoFar;
  private int reposScanned;
  private boolean cancelRequested;
  private Instant startedAt;

  @Autowired
  public ScanProgressTracker() {
    this(Clock.systemDefaultZone());
  }

  public ScanProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Opens the window between admission and {@link #start(Long)}: a cancel requested while armed is
   * accepted and carried into the run.
   */
  public void arm() {
    lock.lock();
    try {
      clearTransient();
      this.armed = true;
    } finally {
      lock.unlock();
    }
  }

  public void start(Long scanId) {
    lock.lock();
    try {
      boolean carriedCancel = armed && cancelRequested;
      clearTransient();
      this.cancelRequested = carriedCancel;
      this.running = true;
      this.scanId = scanId;
      this.startedAt = clock.instant();
    } finally {
      lock.unlock();
    }
    log("Scan started");
  }

  public void stage(PipelineStage stage, String message) {
    lock.lock();
    try {
      this.stage = stage;
      this.message = message == null ? "" : message;
      this.currentItem = "";
      this.progressCurrent = 0;
      this.progressTotal = 0;
    } finally {
      lock.unlock();
    }
    log("[%d] %s: %s".formatted(stage.index(), stage.displayName(), this.message));
  }

  public void progress(int current, int total, String item) {
    lock.lock();
    try {
      this.progressCurrent = current;
      this.progressTotal = total;
      this.currentItem = item == null ? "" : item;
    } finally {
      lock.unlock();
    }
  }

  public void addFindings(int count) {
    lock.lock();
    try {
      this.findingsSoFar += count;
    } finally {
      lock.unlock();
    }
  }

  public void repoScanned() {
    lock.lock();
    try {
      this.reposScanned++;
    } finally {
      lock.unlock();
    }
  }

  public void log(String line) {
    String entry = LOG_TIME.format(clock.instant().atZone(zone())) + " " + line;
    lock.lock();
    try {
      logLines.addLast(entry);
      while (logLines.size() > MAX_LOG_LINES) {
        logLines.removeFirst();
      }
    } finally {
      lock.unlock();
    }
    log.debug("progress: {}", line);
  }

  public void activity(ActivityType type, String text) {
    ActivityEntry entry = new ActivityEntry(clock.instant(), type, text);
    lock.lock();
    try {
      activities.addLast(entry);
      while (activities.size() > MAX_ACTIVITIES) {
        activities.removeFirst();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Flags the running pipeline for cancellation.
   *
   * @return {@code false} when nothing is running or armed
   */
  public boolean requestCancel() {
    lock.lock();
    try {
      if (!running && !armed) {
        return false;
      }
      cancelRequested = true;
    } finally {
      lock.unlock();
    }
    log("Cancellation requested");
    activity(ActivityType.CANCEL, "Cancellation requested");
    return true;
  }

  @Override
  public boolean isCancellationRequested() {
    lock.lock();
    try {
      return cancelRequested;
    } finally {
      lock.unlock();
    }
  }

  public void checkCancelled() {
    throwIfCancelled();
  }

  public boolean isRunning() {
    lock.lock();
    try {
      return running;
    } finally {
      lock.unlock();
    }
  }

  /** Clears per-run state; the activity feed is kept. */
  public void reset() {
    lock.lock();
    try {
      clearTransient();
    } finally {
      lock.unlock();
    }
  }

  public ProgressSnapshot snapshot() {
    lock.lock();
    try {
      int percent = 0;
      if (progressTotal > 0) {
        percent = (int) Math.min(100, Math.round(progressCurrent * 100.0 / progressTotal));
      }
      return new ProgressSnapshot(
          running,
          scanId,
          stage == null ? null : stage.index(),
          stage == null ? null : stage.displayName(),
          message,
          currentItem,
          progressCurrent,
          progressTotal,
          percent,
          findingsSoFar,
          reposScanned,
          cancelRequested,
          startedAt,
          List.copyOf(logLines),
          List.copyOf(activities));
    } finally {
      lock.unlock();
    }
  }

  private void clearTransient() {
    armed = false;
    running = false;
    scanId = null;
    stage = null;
    message = "";
    currentItem = "";
    progressCurrent = 0;
    progressTotal = 0;
    findingsSoFar = 0;
    reposScanned = 0;
    cancelRequested = false;
    startedAt = null;
    logLines.clear();
  }

  private ZoneId zone() {
    return clock.getZone();
  }
}
