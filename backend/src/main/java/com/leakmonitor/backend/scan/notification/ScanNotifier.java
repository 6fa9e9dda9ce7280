package com.leakmonitor.backend.scan.notification;

import com.leakmonitor.backend.scan.domain.Scan;

public interface ScanNotifier {

  String channel();

  default boolean isEnabled() {
    return true;
  }

  /** Announces a finished scan. Failures are reported by throwing; callers only log them. */
  void notify(Scan scan);
}
