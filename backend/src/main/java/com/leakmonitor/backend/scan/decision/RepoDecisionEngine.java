package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks the ordered guard chain for one repository; the first guard that stops decides. A forcing
 * guard lets later guards see {@code forced = true} so they can step aside.
 */
@Component
public class RepoDecisionEngine {

  private static final Logger log = LoggerFactory.getLogger(RepoDecisionEngine.class);

  private final List<RepoDecisionGuard> guards;

  public RepoDecisionEngine(List<RepoDecisionGuard> guards) {
    this.guards = List.copyOf(guards);
  }

  public RepoDecision decide(DiscoveredRepo repo) {
    boolean forced = false;
    for (RepoDecisionGuard guard : guards) {
      GuardVerdict verdict = guard.evaluate(repo, forced);
      switch (verdict.kind()) {
        case STOP -> {
          log.debug("{} stopped by {} -> {}", repo.getFullName(), guard.name(), verdict.status());
          return RepoDecision.skip(verdict.status(), guard.name());
        }
        case FORCE -> forced = true;
        case PROCEED -> {}
      }
    }
    return RepoDecision.scan(forced);
  }

  public List<String> guardOrder() {
    return guards.stream().map(RepoDecisionGuard::name).toList();
  }
}
