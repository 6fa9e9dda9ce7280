package com.leakmonitor.backend.scan.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class StaleScanCleanup {

  private static final Logger log = LoggerFactory.getLogger(StaleScanCleanup.class);

  private final ScanRecoveryService recoveryService;

  public StaleScanCleanup(ScanRecoveryService recoveryService) {
    this.recoveryService = recoveryService;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void cleanupOnStartup() {
    int repaired = recoveryService.cleanupStaleScans();
    if (repaired > 0) {
      log.warn("Marked {} interrupted scans as failed", repaired);
    }
  }
}
