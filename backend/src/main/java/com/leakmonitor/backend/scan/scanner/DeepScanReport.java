package com.leakmonitor.backend.scan.scanner;

import java.util.List;

/**
 * Concatenated scanner output for one repository. {@code workingTreeScanned} is false when the
 * clone failed and only remote scanners ran.
 */
public record DeepScanReport(List<RawFinding> findings, boolean workingTreeScanned) {

  public DeepScanReport {
    findings = findings == null ? List.of() : List.copyOf(findings);
  }
}
