package com.leakmonitor.backend.scan.service;

public enum RescanOutcome {
  /** The detection reappeared; last-seen and snippet were refreshed. */
  CONFIRMED,
  /** The detection is gone and the finding was auto-resolved. */
  RESOLVED,
  /** The working tree could not be scanned, so absence proves nothing. */
  KEPT_OPEN,
  ALREADY_RESOLVED,
  NOT_FOUND,
  FAILED
}
