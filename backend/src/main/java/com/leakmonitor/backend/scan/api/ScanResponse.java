package com.leakmonitor.backend.scan.api;

import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import com.leakmonitor.backend.scan.domain.ScanTrigger;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "One pipeline run with its counters.")
public record ScanResponse(
    Long id,
    ScanStatus status,
    ScanTrigger trigger,
    Instant startedAt,
    Instant finishedAt,
    int keywordsUsed,
    int reposFound,
    int reposScanned,
    int newFindings,
    @Schema(description = "Unresolved findings recorded by this scan.") int totalFindings,
    @Schema(description = "Set for failed scans only.") String errorMessage,
    Double durationSeconds) {

  public static ScanResponse from(Scan scan) {
    return new ScanResponse(
        scan.getId(),
        scan.getStatus(),
        scan.getTrigger(),
        scan.getStartedAt(),
        scan.getFinishedAt(),
        scan.getKeywordsUsed(),
        scan.getReposFound(),
        scan.getReposScanned(),
        scan.getNewFindings(),
        scan.getTotalFindings(),
        scan.getErrorMessage(),
        scan.getDurationSeconds());
  }
}
