package com.leakmonitor.backend.scan.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Whether an operation holds the run slot, and the most recent scan.")
public record ScanStatusResponse(
    boolean running,
    @Schema(description = "Name of the running operation, absent when idle.") String operation,
    @Schema(description = "Most recently started scan, absent before the first run.")
        ScanResponse lastScan) {}
