package com.leakmonitor.backend.scan.domain;

public enum ScanStatus {
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED
}
