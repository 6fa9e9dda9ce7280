package com.leakmonitor.backend.scan.osint;

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

/** Looks for accounts named after company keywords across public platforms with Blackbird. */
@Component
public class AccountSearchModule implements IntelligenceModule {

  private static final Logger log = LoggerFactory.getLogger(AccountSearchModule.class);

  private static final Pattern PROFILE_URL = Pattern.compile("https?://\\S+");
  private static final int MAX_USERNAMES = 3;

  private final ProcessRunner processRunner;

  public AccountSearchModule(ProcessRunner processRunner) {
    this.processRunner = processRunner;
  }

  @Override
  public String key() {
    return "account-search";
  }

  @Override
  public String displayName() {
    return "Account search";
  }

  @Override
  public String description() {
    return "Checks which platforms host an account named after each company keyword (Blackbird).";
  }

  @Override
  public Map<String, String> defaultConfig() {
    return Map.of("binary", "blackbird", "timeout_seconds", "180");
  }

  @Override
  public IntelligenceResult run(List<String> keywords, Map<String, String> config) {
    String binary = config.getOrDefault("binary", "blackbird");
    Duration timeout = Duration.ofSeconds(KeywordHeuristics.intConfig(config, "timeout_seconds", 180));

    List<Observation> observations = new ArrayList<>();
    for (String username : usernames(keywords)) {
      ProcessResult result;
      try {
        result = processRunner.run(List.of(binary, "-u", username, "--no-update"), null, timeout);
      } catch (ProcessExecutionException ex) {
        log.warn("blackbird failed for {}: {}", username, ex.getMessage());
        continue;
      }
      Set<String> profiles = new LinkedHashSet<>();
      Matcher matcher = PROFILE_URL.matcher(result.stdout());
      while (matcher.find()) {
        profiles.add(matcher.group());
      }
      for (String profile : profiles) {
        observations.add(new Observation("account", profile, "blackbird", Map.of("username", username)));
      }
    }
    return new IntelligenceResult(List.of(), observations);
  }

  static List<String> usernames(List<String> keywords) {
    Set<String> names = new LinkedHashSet<>();
    for (String company : KeywordHeuristics.companies(keywords)) {
      String username = company.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
      if (username.length() >= 3) {
        names.add(username);
      }
      if (names.size() >= MAX_USERNAMES) {
        break;
      }
    }
    return List.copyOf(names);
  }
}
