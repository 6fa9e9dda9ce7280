package com.leakmonitor.backend.scan.scanner;

import com.leakmonitor.backend.scan.config.ScanProperties;
import com.leakmonitor.backend.scan.domain.FindingSeverity;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Regex sweep over the working tree of the clone. Dependency and VCS directories, oversized files
 * and non-text extensions are skipped. The commit is always empty.
 */
@Component
@Order(3)
public class CustomPatternScanner implements ExternalScanner {

  public static final String NAME = "custom";

  private static final Logger log = LoggerFactory.getLogger(CustomPatternScanner.class);

  static final List<CustomPattern> BUILT_IN_PATTERNS =
      List.of(
          new CustomPattern(
              "IBAN",
              Pattern.compile("\\b[A-Z]{2}\\d{2}(?: ?[A-Z0-9]{4}){3,7}(?: ?[A-Z0-9]{1,3})?\\b"),
              FindingSeverity.CRITICAL),
          new CustomPattern(
              "Private Key Header",
              Pattern.compile(
                  "-----BEGIN (?:RSA |EC |DSA |OPENSSH |PGP |ENCRYPTED )?PRIVATE KEY(?: BLOCK)?-----"),
              FindingSeverity.CRITICAL),
          new CustomPattern(
              "Hardcoded Password",
              Pattern.compile(
                  "(?i)\\b(?:password|passwd|pwd|secret)\\s*[:=]\\s*[\"'][^\"'\\s]{6,}[\"']"),
              FindingSeverity.HIGH),
          new CustomPattern(
              "Internal IP (10.x)",
              Pattern.compile("\\b10\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b"),
              FindingSeverity.MEDIUM),
          new CustomPattern(
              "Internal IP (172.16/12)",
              Pattern.compile("\\b172\\.(?:1[6-9]|2\\d|3[01])\\.\\d{1,3}\\.\\d{1,3}\\b"),
              FindingSeverity.LOW));

  static final Set<String> SKIPPED_DIRECTORIES =
      Set.of(".git", "node_modules", "vendor", "__pycache__", ".venv", "venv");

  static final Set<String> TEXT_EXTENSIONS =
      Set.of(
          "py", "js", "ts", "java", "go", "rb", "php", "sh", "bash", "yml", "yaml", "json", "xml",
          "toml", "ini", "cfg", "conf", "env", "txt", "md", "rst", "csv", "sql", "tf", "hcl",
          "dockerfile", "properties", "gradle", "kt", "cs", "ps1");

  static final Set<String> TEXT_FILE_NAMES = Set.of(".env", "dockerfile", "makefile");

  private static final int MAX_SNIPPET_CHARS = 200;

  private final ScanProperties properties;

  public CustomPatternScanner(ScanProperties properties) {
    this.properties = properties;
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
    List<CustomPattern> patterns = new ArrayList<>(BUILT_IN_PATTERNS);
    patterns.addAll(target.extraPatterns());
    Path root = target.workingTree();
    long deadline = System.nanoTime() + timeout.toNanos();
    List<RawFinding> findings = new ArrayList<>();
    try {
      Files.walkFileTree(
          root,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
              if (!dir.equals(root) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (System.nanoTime() > deadline) {
                log.warn("custom pattern scan of {} hit its time limit", target.repoFullName());
                return FileVisitResult.TERMINATE;
              }
              if (attrs.isRegularFile()
                  && attrs.size() <= properties.getCustomMaxFileSizeBytes()
                  && isTextFile(file)) {
                scanFile(root, file, patterns, findings);
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException ex) {
      log.warn("custom pattern scan of {} aborted: {}", target.repoFullName(), ex.getMessage());
    }
    return findings;
  }

  static boolean isTextFile(Path file) {
    String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
    if (TEXT_FILE_NAMES.contains(fileName)) {
      return true;
    }
    int dot = fileName.lastIndexOf('.');
    return dot >= 0 && dot < fileName.length() - 1 && TEXT_EXTENSIONS.contains(fileName.substring(dot + 1));
  }

  private void scanFile(Path root, Path file, List<CustomPattern> patterns, List<RawFinding> sink) {
    String content;
    try {
      content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      log.debug("Skipping unreadable file {}: {}", file, ex.getMessage());
      return;
    }
    String relativePath = root.relativize(file).toString().replace('\\', '/');
    String[] lines = content.split("\\R", -1);
    for (int index = 0; index < lines.length; index++) {
      String line = lines[index];
      for (CustomPattern pattern : patterns) {
        if (pattern.regex().matcher(line).find()) {
          String snippet = line.strip();
          sink.add(
              new RawFinding(
                  NAME,
                  pattern.name(),
                  false,
                  relativePath,
                  "",
                  index + 1,
                  pattern.severity(),
                  snippet.length() > MAX_SNIPPET_CHARS ? snippet.substring(0, MAX_SNIPPET_CHARS) : snippet));
        }
      }
    }
  }
}
