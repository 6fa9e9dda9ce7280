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
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Collects addresses published for domain keywords using theHarvester. */
@Component
public class EmailHarvestModule implements IntelligenceModule {

  private static final Logger log = LoggerFactory.getLogger(EmailHarvestModule.class);

  private static final Pattern EMAIL =
      Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

  private final ProcessRunner processRunner;

  public EmailHarvestModule(ProcessRunner processRunner) {
    this.processRunner = processRunner;
  }

  @Override
  public String key() {
    return "email-harvest";
  }

  @Override
  public String displayName() {
    return "Email harvesting";
  }

  @Override
  public String description() {
    return "Runs theHarvester against domain keywords and adds the addresses it finds.";
  }

  @Override
  public Map<String, String> defaultConfig() {
    return Map.of(
        "binary", "theHarvester", "sources", "duckduckgo,crtsh", "limit", "200", "timeout_seconds", "300");
  }

  @Override
  public IntelligenceResult run(List<String> keywords, Map<String, String> config) {
    String binary = config.getOrDefault("binary", "theHarvester");
    String sources = config.getOrDefault("sources", "duckduckgo,crtsh");
    int limit = KeywordHeuristics.intConfig(config, "limit", 200);
    Duration timeout = Duration.ofSeconds(KeywordHeuristics.intConfig(config, "timeout_seconds", 300));

    List<DiscoveredKeyword> discovered = new ArrayList<>();
    List<Observation> observations = new ArrayList<>();
    for (String domain : KeywordHeuristics.domains(keywords)) {
      ProcessResult result;
      try {
        result =
            processRunner.run(
                List.of(binary, "-d", domain, "-b", sources, "-l", Integer.toString(limit)),
                null,
                timeout);
      } catch (ProcessExecutionException ex) {
        log.warn("theHarvester failed for {}: {}", domain, ex.getMessage());
        continue;
      }
      String suffix = "@" + domain.toLowerCase(Locale.ROOT);
      Set<String> emails = new LinkedHashSet<>();
      Matcher matcher = EMAIL.matcher(result.stdout());
      while (matcher.find()) {
        String email = matcher.group().toLowerCase(Locale.ROOT);
        if (email.endsWith(suffix)) {
          emails.add(email);
        }
      }
      for (String email : emails) {
        discovered.add(new DiscoveredKeyword(email, KeywordCategory.EMAIL));
        observations.add(new Observation("email", email, "theHarvester", Map.of("domain", domain)));
      }
    }
    return new IntelligenceResult(discovered, observations);
  }
}
