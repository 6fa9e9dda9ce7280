package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class DismissedGuard implements RepoDecisionGuard {

  @Override
  public String name() {
    return "dismissed";
  }

  @Override
  public GuardVerdict evaluate(DiscoveredRepo repo, boolean forced) {
    return repo.isDismissed() ? GuardVerdict.stop(null) : GuardVerdict.proceed();
  }
}
