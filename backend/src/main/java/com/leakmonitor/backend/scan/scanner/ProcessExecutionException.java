package com.leakmonitor.backend.scan.scanner;

public class ProcessExecutionException extends RuntimeException {

  public enum Kind {
    START_FAILED,
    TIMEOUT,
    INTERRUPTED
  }

  private final Kind kind;

  public ProcessExecutionException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ProcessExecutionException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
