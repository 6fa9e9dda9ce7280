package com.leakmonitor.backend.scan.progress;

public class ScanCancelledException extends RuntimeException {

  public ScanCancelledException() {
    super("Scan cancelled by operator");
  }
}
