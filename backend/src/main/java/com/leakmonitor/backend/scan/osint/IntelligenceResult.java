package com.leakmonitor.backend.scan.osint;

import com.leakmonitor.backend.scan.domain.KeywordCategory;
import java.util.List;
import java.util.Map;

public record IntelligenceResult(List<DiscoveredKeyword> newKeywords, List<Observation> observations) {

  public IntelligenceResult {
    newKeywords = newKeywords == null ? List.of() : List.copyOf(newKeywords);
    observations = observations == null ? List.of() : List.copyOf(observations);
  }

  public static IntelligenceResult empty() {
    return new IntelligenceResult(List.of(), List.of());
  }

  public record DiscoveredKeyword(String term, KeywordCategory category) {}

  public record Observation(String resultType, String value, String source, Map<String, String> metadata) {

    public Observation {
      metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
  }
}
