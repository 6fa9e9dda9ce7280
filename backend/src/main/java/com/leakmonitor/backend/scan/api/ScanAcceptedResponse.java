package com.leakmonitor.backend.scan.api;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Acknowledgement that a scan operation was admitted and queued.")
public record ScanAcceptedResponse(
    @Schema(description = "Operation that now holds the run slot.", example = "scan") String operation,
    @Schema(description = "Always \"accepted\".") String status) {

  public static ScanAcceptedResponse accepted(String operation) {
    return new ScanAcceptedResponse(operation, "accepted");
  }
}
