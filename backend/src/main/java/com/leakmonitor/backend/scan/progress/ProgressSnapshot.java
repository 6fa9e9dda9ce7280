package com.leakmonitor.backend.scan.progress;

import java.time.Instant;
import java.util.List;

public record ProgressSnapshot(
    boolean running,
    Long scanId,
    Integer stageIndex,
    String stageName,
    String message,
    String currentItem,
    int progressCurrent,
    int progressTotal,
    int percent,
    int findingsSoFar,
    int reposScanned,
    boolean cancelRequested,
    Instant startedAt,
    List<String> log,
    List<ActivityEntry> activities) {

  public record ActivityEntry(Instant timestamp, ActivityType type, String message) {}
}
