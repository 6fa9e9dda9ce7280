package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import com.leakmonitor.backend.scan.domain.ScanOverride;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class BlockOverrideGuard implements RepoDecisionGuard {

  @Override
  public String name() {
    return "block-override";
  }

  @Override
  public GuardVerdict evaluate(DiscoveredRepo repo, boolean forced) {
    if (repo.getScanOverride() != ScanOverride.BLOCK) {
      return GuardVerdict.proceed();
    }
    // an earlier verdict on a blocked repo is kept
    return GuardVerdict.stop(repo.isPending() ? RepoScanStatus.SKIPPED : null);
  }
}
