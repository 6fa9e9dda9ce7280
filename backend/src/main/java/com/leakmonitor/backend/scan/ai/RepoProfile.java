package com.leakmonitor.backend.scan.ai;

import java.util.List;

public record RepoProfile(
    String fullName,
    String description,
    String language,
    String readmeExcerpt,
    List<String> matchedKeywords) {

  public RepoProfile {
    matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
  }
}
