package com.leakmonitor.backend.scan.notification;

import com.leakmonitor.backend.scan.domain.NotificationLog;
import com.leakmonitor.backend.scan.domain.Scan;
import com.leakmonitor.backend.scan.persistence.NotificationLogRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Best-effort fan-out to every enabled notifier; nothing thrown here reaches the pipeline. */
@Service
public class NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final List<ScanNotifier> notifiers;
  private final NotificationLogRepository notificationLogRepository;

  public NotificationDispatcher(
      List<ScanNotifier> notifiers, NotificationLogRepository notificationLogRepository) {
    this.notifiers = List.copyOf(notifiers);
    this.notificationLogRepository = notificationLogRepository;
  }

  public void dispatch(Scan scan) {
    for (ScanNotifier notifier : notifiers) {
      if (!notifier.isEnabled()) {
        continue;
      }
      boolean success = true;
      String message = "sent";
      try {
        notifier.notify(scan);
      } catch (RuntimeException ex) {
        success = false;
        message = ex.getMessage();
        log.warn("Notification via {} failed for scan {}", notifier.channel(), scan.getId(), ex);
      }
      try {
        notificationLogRepository.save(new NotificationLog(scan, notifier.channel(), success, message));
      } catch (RuntimeException ex) {
        log.warn("Failed to record {} notification for scan {}", notifier.channel(), scan.getId(), ex);
      }
    }
  }
}
