package com.leakmonitor.backend.scan.github;

import java.util.List;

public record CodeSearchPage(
    List<CodeSearchHit> hits, int totalCount, Integer remaining, Long resetEpochSeconds) {

  public CodeSearchPage {
    hits = hits == null ? List.of() : List.copyOf(hits);
  }
}
