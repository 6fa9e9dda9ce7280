package com.leakmonitor.backend.scan.scheduler;

import com.leakmonitor.backend.scan.domain.ScanTrigger;
import com.leakmonitor.backend.scan.service.ScanAlreadyRunningException;
import com.leakmonitor.backend.scan.service.ScanControlService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "app.scan.schedule",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ScheduledScanTrigger {

  private static final Logger log = LoggerFactory.getLogger(ScheduledScanTrigger.class);

  private final ScanControlService scanControlService;

  public ScheduledScanTrigger(ScanControlService scanControlService) {
    this.scanControlService = scanControlService;
  }

  @Scheduled(
      cron = "${app.scan.schedule.cron:0 0 1 * * *}",
      zone = "${app.scan.schedule.zone:UTC}")
  public void startScheduledScan() {
    try {
      scanControlService.startScan(ScanTrigger.SCHEDULED);
    } catch (ScanAlreadyRunningException ex) {
      log.info("Scheduled scan skipped: {} is running", ex.getRunningOperation());
    }
  }
}
