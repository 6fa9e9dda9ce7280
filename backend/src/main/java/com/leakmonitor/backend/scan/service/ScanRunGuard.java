package com.leakmonitor.backend.scan.service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Single-slot admission for pipeline and recovery runs. Whoever holds the {@link Admission} owns the
 * slot until it is closed.
 */
@Component
public class ScanRunGuard {

  private final AtomicReference<Admission> current = new AtomicReference<>();

  public Optional<Admission> tryAdmit(String operation) {
    Admission admission = new Admission(operation);
    return current.compareAndSet(null, admission) ? Optional.of(admission) : Optional.empty();
  }

  public boolean isHeld() {
    return current.get() != null;
  }

  public Optional<String> currentOperation() {
    Admission admission = current.get();
    return admission == null ? Optional.empty() : Optional.of(admission.operation());
  }

  public final class Admission implements AutoCloseable {

    private final String operation;

    private Admission(String operation) {
      this.operation = operation;
    }

    public String operation() {
      return operation;
    }

    /** Frees the slot. Closing twice, or after another run was admitted, has no effect. */
    @Override
    public void close() {
      current.compareAndSet(this, null);
    }
  }
}
