package com.leakmonitor.backend.scan.github;

public class CodeSearchException extends RuntimeException {

  public enum Reason {
    /** GitHub rejected the query itself (HTTP 422); retrying cannot help. */
    VALIDATION,
    /** Quota exhausted; retry after the reset instant. */
    EXHAUSTED,
    TRANSIENT
  }

  private final Reason reason;
  private final Integer remaining;
  private final Long resetEpochSeconds;

  public CodeSearchException(
      Reason reason, String message, Integer remaining, Long resetEpochSeconds) {
    super(message);
    this.reason = reason;
    this.remaining = remaining;
    this.resetEpochSeconds = resetEpochSeconds;
  }

  public CodeSearchException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.remaining = null;
    this.resetEpochSeconds = null;
  }

  public Reason getReason() {
    return reason;
  }

  public Integer getRemaining() {
    return remaining;
  }

  public Long getResetEpochSeconds() {
    return resetEpochSeconds;
  }
}
