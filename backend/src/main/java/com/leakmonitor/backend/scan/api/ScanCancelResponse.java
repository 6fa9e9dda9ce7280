package com.leakmonitor.backend.scan.api;

import io.swagger.v3.oas.annotations.media.Schema;

public record ScanCancelResponse(
    @Schema(description = "False when nothing was running.") boolean cancelRequested) {}
