package com.leakmonitor.backend.scan.domain;

public enum FindingSeverity {
  CRITICAL,
  HIGH,
  MEDIUM,
  LOW
}
