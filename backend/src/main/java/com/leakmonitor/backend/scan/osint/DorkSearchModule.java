package com.leakmonitor.backend.scan.osint;

import com.leakmonitor.backend.scan.config.GitHubProperties;
import com.leakmonitor.backend.scan.github.CodeSearchClient;
import com.leakmonitor.backend.scan.github.CodeSearchException;
import com.leakmonitor.backend.scan.github.CodeSearchHit;
import com.leakmonitor.backend.scan.github.CodeSearchPage;
import com.leakmonitor.backend.scan.github.GitHubRateLimiter;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.Observation;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs targeted GitHub code-search dorks (keyword combined with secret-bearing file types) for the
 * first keywords. Hits are recorded as evidence; the keyword set is unchanged.
 */
@Component
public class DorkSearchModule implements IntelligenceModule {

  private static final Logger log = LoggerFactory.getLogger(DorkSearchModule.class);

  static final List<String> DORKS =
      List.of("filename:.env", "extension:pem", "filename:credentials", "password", "api_key");

  private final CodeSearchClient codeSearchClient;
  private final GitHubRateLimiter rateLimiter;
  private final GitHubProperties properties;

  public DorkSearchModule(
      CodeSearchClient codeSearchClient, GitHubRateLimiter rateLimiter, GitHubProperties properties) {
    this.codeSearchClient = codeSearchClient;
    this.rateLimiter = rateLimiter;
    this.properties = properties;
  }

  @Override
  public String key() {
    return "dork-search";
  }

  @Override
  public String displayName() {
    return "GitHub dorks";
  }

  @Override
  public String description() {
    return "Combines keywords with secret-revealing search qualifiers on GitHub code search.";
  }

  @Override
  public Map<String, String> defaultConfig() {
    return Map.of("max_keywords", "5");
  }

  @Override
  public IntelligenceResult run(List<String> keywords, Map<String, String> config) {
    int maxKeywords = KeywordHeuristics.intConfig(config, "max_keywords", 5);
    List<Observation> observations = new ArrayList<>();
    for (String keyword : keywords.stream().limit(maxKeywords).toList()) {
      for (String dork : DORKS) {
        if (!rateLimiter.acquire(properties.getSearchAcquireTimeout())) {
          log.warn("dork-search gave up waiting for a rate limit token");
          return new IntelligenceResult(List.of(), observations);
        }
        String query = "\"" + keyword + "\" " + dork;
        CodeSearchPage page;
        try {
          page = codeSearchClient.searchQuery(query, 1);
        } catch (CodeSearchException ex) {
          rateLimiter.adapt(ex.getRemaining(), ex.getResetEpochSeconds());
          log.debug("Dork '{}' failed: {}", query, ex.getMessage());
          continue;
        }
        rateLimiter.adapt(page.remaining(), page.resetEpochSeconds());
        for (CodeSearchHit hit : page.hits()) {
          observations.add(
              new Observation(
                  "dork_hit",
                  hit.repoFullName() + "/" + hit.filePath(),
                  "github",
                  Map.of("keyword", keyword, "dork", dork)));
        }
      }
    }
    return new IntelligenceResult(List.of(), observations);
  }
}
