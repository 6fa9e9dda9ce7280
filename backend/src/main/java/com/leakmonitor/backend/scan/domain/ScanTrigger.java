package com.leakmonitor.backend.scan.domain;

public enum ScanTrigger {
  SCHEDULED,
  MANUAL
}
