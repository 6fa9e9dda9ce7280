package com.leakmonitor.backend.scan.scanner;

import com.leakmonitor.backend.scan.domain.FindingSeverity;
import com.leakmonitor.backend.scan.identity.FindingHasher;

/** Detection as reported by one scanner, before deduplication. */
public record RawFinding(
    String scanner,
    String detectorName,
    boolean verified,
    String filePath,
    String commit,
    Integer lineNumber,
    FindingSeverity severity,
    String snippet) {

  public String identity(String repoFullName) {
    return FindingHasher.hash(scanner, detectorName, repoFullName, filePath, commit, lineNumber);
  }
}
