package com.leakmonitor.backend.scan.progress;

public enum ActivityType {
  START,
  KEYWORD,
  WARN,
  GITHUB,
  GITLEAKS,
  TRUFFLEHOG,
  CUSTOM,
  AI,
  OSINT,
  FINDING,
  ERROR,
  DONE,
  CANCEL
}
