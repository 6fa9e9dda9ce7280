package com.leakmonitor.backend.scan.scanner;

import java.time.Duration;
import java.util.List;

/**
 * A secret-detection tool run against one repository. Implementations never throw on timeouts,
 * missing binaries or unreadable output; they log and return an empty list instead.
 */
public interface ExternalScanner {

  String name();

  boolean requiresWorkingTree();

  Duration defaultTimeout();

  List<RawFinding> scan(ScanTarget target, Duration timeout);
}
