package com.leakmonitor.backend.scan.persistence;

import com.leakmonitor.backend.scan.domain.NotificationLog;
import org.springframework.data.jpa.repository.JpaRepository;

public interface NotificationLogRepository extends JpaRepository<NotificationLog, Long> {}
