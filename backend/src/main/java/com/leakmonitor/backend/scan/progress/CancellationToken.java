package com.leakmonitor.backend.scan.progress;

/** Cooperative cancellation checkpoint passed down the scan call chains. */
public interface CancellationToken {

  CancellationToken NONE =
      new CancellationToken() {
        @Override
        public boolean isCancellationRequested() {
          return false;
        }
      };

  boolean isCancellationRequested();

  /**
   * @throws ScanCancelledException when cancellation was requested
   */
  default void throwIfCancelled() {
    if (isCancellationRequested()) {
      throw new ScanCancelledException();
    }
  }
}
