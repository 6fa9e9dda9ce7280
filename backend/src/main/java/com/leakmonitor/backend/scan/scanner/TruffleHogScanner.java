package com.leakmonitor.backend.scan.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakmonitor.backend.scan.config.ScanProperties;
import com.leakmonitor.backend.scan.domain.FindingSeverity;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Scans the full remote history through the URL; no clone needed. */
@Component
@Order(1)
public class TruffleHogScanner implements ExternalScanner {

  public static final String NAME = "trufflehog";

  private static final Logger log = LoggerFactory.getLogger(TruffleHogScanner.class);

  private static final int MAX_SNIPPET_CHARS = 500;

  private final ProcessRunner processRunner;
  private final ScanProperties properties;
  private final ObjectMapper objectMapper;

  public TruffleHogScanner(
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
    return false;
  }

  @Override
  public Duration defaultTimeout() {
    return properties.getTrufflehogTimeout();
  }

  @Override
  public List<RawFinding> scan(ScanTarget target, Duration timeout) {
    List<String> command =
        List.of(
            properties.getTrufflehogBinary(),
            "git",
            target.remoteUrl(),
            "--json",
            "--no-update",
            "--no-verification");
    ProcessResult result;
    try {
      result = processRunner.run(command, null, timeout);
    } catch (ProcessExecutionException ex) {
      log.warn("trufflehog skipped for {}: {}", target.repoFullName(), ex.getMessage());
      return List.of();
    }
    return parse(result.stdout());
  }

  List<RawFinding> parse(String output) {
    List<RawFinding> findings = new ArrayList<>();
    if (output == null || output.isBlank()) {
      return findings;
    }
    for (String line : output.split("\\R")) {
      String trimmed = line.trim();
      if (!trimmed.startsWith("{")) {
        continue;
      }
      JsonNode node;
      try {
        node = objectMapper.readTree(trimmed);
      } catch (IOException ex) {
        log.debug("Ignoring unparseable trufflehog line: {}", ex.getMessage());
        continue;
      }
      JsonNode git = node.path("SourceMetadata").path("Data").path("Git");
      boolean verified = node.path("Verified").asBoolean(false);
      String detector = node.path("DetectorName").asText("");
      if (detector.isEmpty()) {
        detector = node.path("DetectorType").asText("unknown");
      }
      String commit = git.path("commit").asText("");
      int lineNumber = git.path("line").asInt(0);
      String raw = node.path("Raw").asText("");
      findings.add(
          new RawFinding(
              NAME,
              detector,
              verified,
              git.path("file").asText(""),
              commit.length() > 8 ? commit.substring(0, 8) : commit,
              lineNumber,
              verified ? FindingSeverity.CRITICAL : FindingSeverity.HIGH,
              raw.length() > MAX_SNIPPET_CHARS ? raw.substring(0, MAX_SNIPPET_CHARS) : raw));
    }
    return findings;
  }
}
