package com.leakmonitor.backend.scan.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakmonitor.backend.scan.config.ScanProperties;
import com.leakmonitor.backend.scan.domain.FindingSeverity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Scans the history of the local clone and reads the JSON report gitleaks writes. */
@Component
@Order(2)
public class GitleaksScanner implements ExternalScanner {

  public static final String NAME = "gitleaks";

  private static final Logger log = LoggerFactory.getLogger(GitleaksScanner.class);

  private static final Set<String> HIGH_RISK_RULE_MARKERS = Set.of("privatekey", "aws", "gcp", "azure");
  private static final int MAX_SNIPPET_CHARS = 500;

  private final ProcessRunner processRunner;
  private final ScanProperties properties;
  private final ObjectMapper objectMapper;

  public GitleaksScanner(
      ProcessRunner processRunner, ScanProperties properties, ObjectMapper objectMapper) {
    this.processRunner = processRunner;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean requiresWorkingTree() {
    return true;
  }

  @Override
  public Duration defaultTimeout() {
    return properties.getGitleaksTimeout();
  }

  @Override
  public List<RawFinding> scan(ScanTarget target, Duration timeout) {
    if (!target.hasWorkingTree()) {
      return List.of();
    }
    Path report = null;
    try {
      report = Files.createTempFile("gitleaks-", ".json");
      List<String> command =
          List.of(
              properties.getGitleaksBinary(),
              "detect",
              "--source=" + target.workingTree(),
              "--report-format=json",
              "--report-path=" + report,
              "--no-banner");
      ProcessResult result = processRunner.run(command, null, timeout);
      // exit code 1 means leaks were found
      if (result.exitCode() > 1) {
        log.warn(
            "gitleaks exited with {} for {}: {}",
            result.exitCode(),
            target.repoFullName(),
            abbreviate(result.stderr()));
        return List.of();
      }
      if (!Files.exists(report) || Files.size(report) == 0) {
        return List.of();
      }
      return parse(Files.readString(report));
    } catch (ProcessExecutionException ex) {
      log.warn("gitleaks skipped for {}: {}", target.repoFullName(), ex.getMessage());
      return List.of();
    } catch (IOException ex) {
      log.warn("gitleaks report unavailable for {}: {}", target.repoFullName(), ex.getMessage());
      return List.of();
    } finally {
      deleteQuietly(report);
    }
  }

  List<RawFinding> parse(String reportJson) {
    List<RawFinding> findings = new ArrayList<>();
    JsonNode root;
    try {
      root = objectMapper.readTree(reportJson);
    } catch (IOException ex) {
      log.warn("Unparseable gitleaks report: {}", ex.getMessage());
      return findings;
    }
    if (root == null || !root.isArray()) {
      return findings;
    }
    for (JsonNode leak : root) {
      String ruleId = leak.path("RuleID").asText("unknown");
      boolean verified = false;
      for (JsonNode tag : leak.path("Tags")) {
        if ("verified".equalsIgnoreCase(tag.asText())) {
          verified = true;
        }
      }
      String commit = leak.path("Commit").asText("");
      String match = leak.path("Match").asText("");
      findings.add(
          new RawFinding(
              NAME,
              ruleId,
              verified,
              leak.path("File").asText(""),
              commit.length() > 8 ? commit.substring(0, 8) : commit,
              leak.path("StartLine").asInt(0),
              severityFor(ruleId, verified),
              match.length() > MAX_SNIPPET_CHARS ? match.substring(0, MAX_SNIPPET_CHARS) : match));
    }
    return findings;
  }

  static FindingSeverity severityFor(String ruleId, boolean verified) {
    if (verified) {
      return FindingSeverity.CRITICAL;
    }
    String normalized = ruleId == null ? "" : ruleId.toLowerCase(Locale.ROOT).replace("-", "");
    for (String marker : HIGH_RISK_RULE_MARKERS) {
      if (normalized.contains(marker)) {
        return FindingSeverity.HIGH;
      }
    }
    return FindingSeverity.MEDIUM;
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() > 300 ? text.substring(0, 300) : text;
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      log.debug("Failed to delete gitleaks report {}: {}", path, ex.getMessage());
    }
  }
}
