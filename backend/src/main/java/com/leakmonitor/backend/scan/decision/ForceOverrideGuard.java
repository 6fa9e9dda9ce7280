package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.ScanOverride;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(40)
public class ForceOverrideGuard implements RepoDecisionGuard {

  @Override
  public String name() {
    return "force-override";
  }

  @Override
  public GuardVerdict evaluate(DiscoveredRepo repo, boolean forced) {
    return repo.getScanOverride() == ScanOverride.FORCE_SCAN
        ? GuardVerdict.force()
        : GuardVerdict.proceed();
  }
}
