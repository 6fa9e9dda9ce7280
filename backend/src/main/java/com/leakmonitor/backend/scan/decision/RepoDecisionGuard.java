package com.leakmonitor.backend.scan.decision;

import com.leakmonitor.backend.scan.domain.DiscoveredRepo;

public interface RepoDecisionGuard {

  String name();

  /**
   * @param forced whether an earlier guard already forced a deep scan
   */
  GuardVerdict evaluate(DiscoveredRepo repo, boolean forced);
}
