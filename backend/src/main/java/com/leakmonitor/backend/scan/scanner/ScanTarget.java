package com.leakmonitor.backend.scan.scanner;

import java.nio.file.Path;
import java.util.List;
import org.springframework.lang.Nullable;

/**
 * What a scanner looks at: the remote URL always, the working tree only when the clone succeeded.
 */
public record ScanTarget(
    String repoFullName,
    String remoteUrl,
    @Nullable Path workingTree,
    List<CustomPattern> extraPatterns) {

  public ScanTarget {
    extraPatterns = extraPatterns == null ? List.of() : List.copyOf(extraPatterns);
  }

  public boolean hasWorkingTree() {
    return workingTree != null;
  }
}
