package com.leakmonitor.backend.scan.domain;

/** Lifecycle of a discovered repository within the analysis stage. */
public enum RepoScanStatus {
  PENDING,
  SKIPPED,
  LOW_RELEVANCE,
  UNCHANGED,
  FINDINGS,
  CLEAN
}
