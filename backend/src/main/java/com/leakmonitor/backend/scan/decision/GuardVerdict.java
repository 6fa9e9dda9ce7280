package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import org.springframework.lang.Nullable;

/** Outcome of one guard: continue down the chain, stop here, or force a deep scan. */
public record GuardVerdict(Kind kind, @Nullable RepoScanStatus status) {

  public enum Kind {
    PROCEED,
    STOP,
    FORCE
  }

  private static final GuardVerdict PROCEED = new GuardVerdict(Kind.PROCEED, null);
  private static final GuardVerdict FORCE = new GuardVerdict(Kind.FORCE, null);

  public static GuardVerdict proceed() {
    return PROCEED;
  }

  public static GuardVerdict force() {
    return FORCE;
  }

  /** Stops the chain; a {@code null} status leaves the stored status untouched. */
  public static GuardVerdict stop(@Nullable RepoScanStatus status) {
    return new GuardVerdict(Kind.STOP, status);
  }
}
