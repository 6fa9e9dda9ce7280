package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import java.util.Optional;
import org.springframework.lang.Nullable;

public record RepoDecision(
    boolean deepScan, boolean forced, @Nullable RepoScanStatus status, String decidedBy) {

  public static RepoDecision skip(@Nullable RepoScanStatus status, String decidedBy) {
    return new RepoDecision(false, false, status, decidedBy);
  }

  public static RepoDecision scan(boolean forced) {
    return new RepoDecision(true, forced, null, forced ? "force-override" : "default");
  }

  public Optional<RepoScanStatus> statusToWrite() {
    return Optional.ofNullable(status);
  }
}
