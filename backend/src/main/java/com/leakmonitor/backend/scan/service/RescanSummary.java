package com.leakmonitor.backend.scan.service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

public record RescanSummary(int repositories, Map<RescanOutcome, Integer> outcomes) {

  public RescanSummary {
    outcomes = Map.copyOf(outcomes);
  }

  static RescanSummary of(int repositories, Collection<RescanOutcome> results) {
    Map<RescanOutcome, Integer> counts = new EnumMap<>(RescanOutcome.class);
    results.forEach(outcome -> counts.merge(outcome, 1, Integer::sum));
    return new RescanSummary(repositories, counts);
  }

  public int count(RescanOutcome outcome) {
    return outcomes.getOrDefault(outcome, 0);
  }
}
