package com.leakmonitor.backend.scan.osint;

import com.leakmonitor.backend.scan.osint.IntelligenceResult.Observation;
import com.leakmonitor.backend.scan.scanner.ProcessExecutionException;
import com.leakmonitor.backend.scan.scanner.ProcessRunner;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives likely employee addresses for company keywords with CrossLinked. Results are recorded as
 * evidence only; they are not searched for.
 */
@Component
public class PeopleSearchModule implements IntelligenceModule {

  private static final Logger log = LoggerFactory.getLogger(PeopleSearchModule.class);

  private static final int MAX_COMPANIES = 3;

  private final ProcessRunner processRunner;

  public PeopleSearchModule(ProcessRunner processRunner) {
    this.processRunner = processRunner;
  }

  @Override
  public String key() {
    return "people-search";
  }

  @Override
  public String displayName() {
    return "People search";
  }

  @Override
  public String description() {
    return "Lists employees of company keywords with CrossLinked and renders their likely addresses.";
  }

  @Override
  public Map<String, String> defaultConfig() {
    return Map.of("binary", "crosslinked", "email_format", "", "timeout_seconds", "300");
  }

  @Override
  public IntelligenceResult run(List<String> keywords, Map<String, String> config) {
    String format = config.getOrDefault("email_format", "");
    if (format.isBlank()) {
      log.info("people-search needs an email_format such as {first}.{last}@example.com, skipping");
      return IntelligenceResult.empty();
    }
    String binary = config.getOrDefault("binary", "crosslinked");
    Duration timeout = Duration.ofSeconds(KeywordHeuristics.intConfig(config, "timeout_seconds", 300));

    List<Observation> observations = new ArrayList<>();
    for (String company : KeywordHeuristics.companies(keywords).stream().limit(MAX_COMPANIES).toList()) {
      Path workDir = null;
      try {
        workDir = Files.createTempDirectory("crosslinked-");
        processRunner.run(List.of(binary, "-f", format, "-o", "names", company), workDir, timeout);
        for (String entry : readResults(workDir)) {
          observations.add(new Observation("person", entry, "crosslinked", Map.of("company", company)));
        }
      } catch (ProcessExecutionException ex) {
        log.warn("crosslinked failed for {}: {}", company, ex.getMessage());
      } catch (IOException ex) {
        throw new UncheckedIOException("crosslinked workspace unavailable", ex);
      } finally {
        deleteQuietly(workDir);
      }
    }
    return new IntelligenceResult(List.of(), observations);
  }

  private Set<String> readResults(Path workDir) throws IOException {
    Set<String> entries = new LinkedHashSet<>();
    Path names = workDir.resolve("names.txt");
    if (!Files.exists(names)) {
      return entries;
    }
    for (String line : Files.readAllLines(names)) {
      if (!line.isBlank()) {
        entries.add(line.trim());
      }
    }
    return entries;
  }

  private void deleteQuietly(Path dir) {
    if (dir == null) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
    } catch (IOException ex) {
      log.debug("Failed to delete {}: {}", dir, ex.getMessage());
    }
  }
}
