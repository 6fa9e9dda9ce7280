package com.leakmonitor.backend.scan.scanner;

import com.leakmonitor.backend.scan.progress.ActivityType;
import com.leakmonitor.backend.scan.progress.CancellationToken;
import com.leakmonitor.backend.scan.progress.ScanProgressTracker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

/**
 * Runs every {@link ExternalScanner} against one repository and concatenates their output. The
 * clone lives only for the duration of the call.
 */
@Service
public class DeepScanService {

  private static final Logger log = LoggerFactory.getLogger(DeepScanService.class);

  private final List<ExternalScanner> scanners;
  private final RepositoryCloner cloner;
  private final ScanProgressTracker progress;
  private final MeterRegistry meterRegistry;

  public DeepScanService(
      List<ExternalScanner> scanners,
      RepositoryCloner cloner,
      ScanProgressTracker progress,
      @Nullable MeterRegistry meterRegistry) {
    this.scanners = List.copyOf(scanners);
    this.cloner = cloner;
    this.progress = progress;
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
  }

  /**
   * Scans the repository, checking the token between scanners.
   *
   * @throws com.leakmonitor.backend.scan.progress.ScanCancelledException when cancelled between
   *     scanners; the clone is removed first
   */
  public DeepScanReport scan(
      String repoFullName, List<CustomPattern> extraPatterns, CancellationToken token) {
    String remoteUrl = "https://github.com/" + repoFullName + ".git";
    List<RawFinding> findings = new ArrayList<>();

    for (ExternalScanner scanner : scanners) {
      if (!scanner.requiresWorkingTree()) {
        token.throwIfCancelled();
        findings.addAll(
            runScanner(scanner, new ScanTarget(repoFullName, remoteUrl, null, extraPatterns)));
      }
    }

    token.throwIfCancelled();
    try (CloneWorkspace workspace = cloner.cloneShallow(repoFullName, remoteUrl)) {
      if (!workspace.isCloned()) {
        progress.activity(ActivityType.WARN, "Clone failed: " + repoFullName);
        return new DeepScanReport(findings, false);
      }
      ScanTarget target =
          new ScanTarget(repoFullName, remoteUrl, workspace.checkoutPath(), extraPatterns);
      for (ExternalScanner scanner : scanners) {
        if (scanner.requiresWorkingTree()) {
          token.throwIfCancelled();
          findings.addAll(runScanner(scanner, target));
        }
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to prepare clone workspace for " + repoFullName, ex);
    }
    return new DeepScanReport(findings, true);
  }

  /** Whether findings of the named scanner can only be reproduced from a local clone. */
  public boolean requiresWorkingTree(String scannerName) {
    return scanners.stream()
        .filter(scanner -> scanner.name().equals(scannerName))
        .anyMatch(ExternalScanner::requiresWorkingTree);
  }

  private List<RawFinding> runScanner(ExternalScanner scanner, ScanTarget target) {
    progress.log("  %s: %s".formatted(scanner.name(), target.repoFullName()));
    List<RawFinding> result = scanner.scan(target, scanner.defaultTimeout());
    meterRegistry.counter("leakmonitor.scanner.runs", "scanner", scanner.name()).increment();
    if (!result.isEmpty()) {
      progress.activity(
          activityType(scanner.name()),
          "%s: %d hits in %s".formatted(scanner.name(), result.size(), target.repoFullName()));
    }
    log.debug("{} reported {} hits for {}", scanner.name(), result.size(), target.repoFullName());
    return result;
  }

  private static ActivityType activityType(String scannerName) {
    try {
      return ActivityType.valueOf(scannerName.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return ActivityType.FINDING;
    }
  }
}
