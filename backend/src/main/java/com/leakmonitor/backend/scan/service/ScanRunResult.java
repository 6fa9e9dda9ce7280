package com.leakmonitor.backend.scan.service;

import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.domain.ScanStatus;
import org.springframework.lang.Nullable;

/** Outcome of a synchronous pipeline run. {@code admitted == false} means another run held the slot. */
public record ScanRunResult(boolean admitted, @Nullable Long scanId, @Nullable ScanStatus status) {

  public static ScanRunResult alreadyRunning() {
    return new ScanRunResult(false, null, null);
  }

  static ScanRunResult of(@Nullable Scan scan) {
    return scan == null
        ? new ScanRunResult(true, null, ScanStatus.FAILED)
        : new ScanRunResult(true, scan.getId(), scan.getStatus());
  }
}
