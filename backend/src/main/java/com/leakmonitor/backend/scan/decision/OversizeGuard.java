package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.config.ScanProperties;
import com.leakmonitor.backend.scan.domain.DiscoveredRepo;
import com.leakmonitor.backend.scan.domain.RepoScanStatus;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(20)
public class OversizeGuard implements RepoDecisionGuard {

  private final ScanProperties properties;

  public OversizeGuard(ScanProperties properties) {
    this.properties = properties;
  }

  @Override
  public String name() {
    return "oversize";
  }

  @Override
  public GuardVerdict evaluate(DiscoveredRepo repo, boolean forced) {
    Long sizeKb = repo.getRepoSizeKb();
    if (sizeKb != null && sizeKb > properties.maxRepoSizeKb()) {
      return GuardVerdict.stop(RepoScanStatus.SKIPPED);
    }
    return GuardVerdict.proceed();
  }
}
