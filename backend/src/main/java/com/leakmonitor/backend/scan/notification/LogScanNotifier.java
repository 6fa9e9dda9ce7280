package com.leakmonitor.backend.scan.notification;

import com.leakmonitor.backend.scan.domain.Scan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LogScanNotifier implements ScanNotifier {

  private static final Logger log = LoggerFactory.getLogger(LogScanNotifier.class);

  @Override
  public String channel() {
    return "log";
  }

  @Override
  public void notify(Scan scan) {
    log.info(ScanSummaryFormatter.summary(scan));
  }
}
