package com.leakmonitor.backend.scan.scanner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/** Runs external tools with a hard timeout, capturing both output streams. */
@Component
public class ProcessRunner {

  private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

  private static final int MAX_CAPTURE_CHARS = 32 * 1024 * 1024;

  public ProcessResult run(List<String> command, @Nullable Path workingDirectory, Duration timeout) {
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDirectory != null) {
      builder.directory(workingDirectory.toFile());
    }
    builder.redirectErrorStream(false);
    builder.environment().put("GIT_TERMINAL_PROMPT", "0");

    Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      throw new ProcessExecutionException(
          ProcessExecutionException.Kind.START_FAILED,
          "Failed to start " + command.get(0) + ": " + ex.getMessage(),
          ex);
    }

    StringBuilder stdout = new StringBuilder();
    StringBuilder stderr = new StringBuilder();
    Thread stdoutReader =
        new Thread(() -> consumeStream(process.getInputStream(), stdout), "process-runner-stdout");
    Thread stderrReader =
        new Thread(() -> consumeStream(process.getErrorStream(), stderr), "process-runner-stderr");
    stdoutReader.setDaemon(true);
    stderrReader.setDaemon(true);
    stdoutReader.start();
    stderrReader.start();

    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        stdoutReader.join(TimeUnit.SECONDS.toMillis(2));
        stderrReader.join(TimeUnit.SECONDS.toMillis(2));
        throw new ProcessExecutionException(
            ProcessExecutionException.Kind.TIMEOUT,
            command.get(0) + " timed out after " + timeout.toSeconds() + " seconds");
      }
      stdoutReader.join(TimeUnit.SECONDS.toMillis(2));
      stderrReader.join(TimeUnit.SECONDS.toMillis(2));
    } catch (InterruptedException ex) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ProcessExecutionException(
          ProcessExecutionException.Kind.INTERRUPTED, command.get(0) + " interrupted", ex);
    }
    return new ProcessResult(process.exitValue(), snapshot(stdout), snapshot(stderr));
  }

  private static String snapshot(StringBuilder buffer) {
    synchronized (buffer) {
      return buffer.toString();
    }
  }

  private void consumeStream(InputStream stream, StringBuilder target) {
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        synchronized (target) {
          if (target.length() < MAX_CAPTURE_CHARS) {
            target.append(line).append('\n');
          }
        }
      }
    } catch (IOException ex) {
      log.debug("Failed to read process stream: {}", ex.getMessage());
    }
  }
}
