package com.leakmonitor.backend.scan.progress;

public enum PipelineStage {
  PREPARATION(0, "Preparation"),
  OSINT(1, "OSINT"),
  CODE_SEARCH(2, "GitHub search"),
  REPO_ANALYSIS(3, "Repository analysis"),
  FINALIZE(4, "Finalize");

  private final int index;
  private final String displayName;

  PipelineStage(int index, String displayName) {
    this.index = index;
    this.displayName = displayName;
  }

  public int index() {
    return index;
  }

  public String displayName() {
    return displayName;
  }
}
