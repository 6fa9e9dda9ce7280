package com.leakmonitor.backend.scan.notification;

import com.leakmonitor.backend.scan.domain.Scan;
import java.util.Locale;

final class ScanSummaryFormatter {

  private ScanSummaryFormatter() {}

  static String summary(Scan scan) {
    double duration = scan.getDurationSeconds() == null ? 0.0 : scan.getDurationSeconds();
    return String.format(
        Locale.ROOT,
        "Scan #%d %s: %d new findings (%d open), %d of %d repositories scanned, %d keywords, %.0fs",
        scan.getId(),
        scan.getStatus().name().toLowerCase(Locale.ROOT),
        scan.getNewFindings(),
        scan.getTotalFindings(),
        scan.getReposScanned(),
        scan.getReposFound(),
        scan.getKeywordsUsed(),
        duration);
  }
}
