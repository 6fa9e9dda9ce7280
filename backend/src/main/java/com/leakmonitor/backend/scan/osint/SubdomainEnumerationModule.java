package com.leakmonitor.backend.scan.osint;

import com.leakmonitor.backend.scan.domain.KeywordCategory;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.DiscoveredKeyword;
import com.leakmonitor.backend.scan.osint.IntelligenceResult.Observation;
import com.leakmonitor.backend.scan.scanner.ProcessExecutionException;
import com.leakmonitor.backend.scan.scanner.ProcessResult;
import com.leakmonitor.backend.scan.scanner.ProcessRunner;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Passive subdomain discovery with subfinder for every domain-shaped keyword. */
@Component
public class SubdomainEnumerationModule implements IntelligenceModule {

  private static final Logger log = LoggerFactory.getLogger(SubdomainEnumerationModule.class);

  private final ProcessRunner processRunner;

  public SubdomainEnumerationModule(ProcessRunner processRunner) {
    this.processRunner = processRunner;
  }

  @Override
  public String key() {
    return "subdomain-enum";
  }

  @Override
  public String displayName() {
    return "Subdomain enumeration";
  }

  @Override
  public String description() {
    return "Finds subdomains of domain keywords with subfinder and searches for them as well.";
  }

  @Override
  public Map<String, String> defaultConfig() {
    return Map.of("binary", "subfinder", "timeout_seconds", "120", "max_results", "50");
  }

  @Override
  public IntelligenceResult run(List<String> keywords, Map<String, String> config) {
    String binary = config.getOrDefault("binary", "subfinder");
    Duration timeout = Duration.ofSeconds(KeywordHeuristics.intConfig(config, "timeout_seconds", 120));
    int maxResults = KeywordHeuristics.intConfig(config, "max_results", 50);

    List<DiscoveredKeyword> discovered = new ArrayList<>();
    List<Observation> observations = new ArrayList<>();
    for (String domain : KeywordHeuristics.domains(keywords)) {
      ProcessResult result;
      try {
        result = processRunner.run(List.of(binary, "-d", domain, "-silent"), null, timeout);
      } catch (ProcessExecutionException ex) {
        log.warn("subfinder failed for {}: {}", domain, ex.getMessage());
        continue;
      }
      Set<String> subdomains = new LinkedHashSet<>();
      for (String line : result.stdout().split("\\R")) {
        String candidate = line.trim().toLowerCase(Locale.ROOT);
        if (!candidate.isEmpty()
            && !candidate.equals(domain.toLowerCase(Locale.ROOT))
            && KeywordHeuristics.isDomain(candidate)) {
          subdomains.add(candidate);
        }
        if (subdomains.size() >= maxResults) {
          break;
        }
      }
      for (String subdomain : subdomains) {
        discovered.add(new DiscoveredKeyword(subdomain, KeywordCategory.DOMAIN));
        observations.add(new Observation("subdomain", subdomain, "subfinder", Map.of("domain", domain)));
      }
    }
    return new IntelligenceResult(discovered, observations);
  }
}
