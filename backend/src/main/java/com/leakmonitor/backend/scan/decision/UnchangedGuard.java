package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Skips repositories with no push since the last scan. A push at exactly the last scan instant
 * counts as unchanged; an unreadable timestamp means the repository is scanned.
 */
@Component
@Order(60)
public class UnchangedGuard implements RepoDecisionGuard {

  private static final Logger log = LoggerFactory.getLogger(UnchangedGuard.class);

  @Override
  public String name() {
    return "unchanged";
  }

  @Override
  public GuardVerdict evaluate(DiscoveredRepo repo, boolean forced) {
    if (forced || repo.getLastScanned() == null || repo.getGithubPushedAt() == null) {
      return GuardVerdict.proceed();
    }
    Instant pushedAt;
    try {
      pushedAt = OffsetDateTime.parse(repo.getGithubPushedAt().trim()).toInstant();
    } catch (DateTimeParseException ex) {
      log.debug("Unreadable push timestamp '{}' for {}", repo.getGithubPushedAt(), repo.getFullName());
      return GuardVerdict.proceed();
    }
    if (!pushedAt.isAfter(repo.getLastScanned())) {
      return GuardVerdict.stop(RepoScanStatus.UNCHANGED);
    }
    return GuardVerdict.proceed();
  }
}
