package com.leakmonitor.backend.scan.ai;

public record RelevanceVerdict(double score, String summary) {

  /** Used whenever the assessment cannot be obtained, so the repository is still scanned. */
  public static RelevanceVerdict scanOnUncertainty(String reason) {
    return new RelevanceVerdict(1.0, reason);
  }
}
