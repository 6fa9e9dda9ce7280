package com.leakmonitor.backend.scan.service;

public class ScanAlreadyRunningException extends RuntimeException {

  private final String runningOperation;

  public ScanAlreadyRunningException(String runningOperation) {
    super("A scan operation is already running: " + runningOperation);
    this.runningOperation = runningOperation;
  }

  public String getRunningOperation() {
    return runningOperation;
  }
}
