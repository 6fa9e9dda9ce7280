package com.leakmonitor.backend.scan.domain;

public enum ScanOverride {
  AUTO,
  FORCE_SCAN,
  BLOCK
}
