package com.leakmonitor.backend.scan.api;

import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.Map;

@Schema(description = "Totals across all scans.")
public record ScanSummaryResponse(
    long totalScans,
    @Schema(description = "Unresolved findings across all repositories.") long openFindings,
    @Schema(description = "Discovered repositories per analysis status.")
        Map<RepoScanStatus, Long> reposByStatus) {}
