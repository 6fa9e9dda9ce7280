package com.leakmonitor.backend.scan.scanner;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Temporary directory holding one clone; removed with everything inside on {@link #close()}. */
public final class CloneWorkspace implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(CloneWorkspace.class);

  private final Path directory;
  private boolean cloned;

  CloneWorkspace(Path directory) {
    this.directory = directory;
  }

  public Path directory() {
    return directory;
  }

  /** Target path handed to {@code git clone}; created by git itself. */
  public Path checkoutPath() {
    return directory.resolve("repo");
  }

  public boolean isCloned() {
    return cloned;
  }

  void markCloned() {
    this.cloned = true;
  }

  @Override
  public void close() {
    if (!Files.exists(directory)) {
      return;
    }
    try {
      deleteRecursively(directory);
    } catch (IOException ex) {
      log.warn("Failed to delete clone workspace {}", directory, ex);
    }
  }

  static void deleteRecursively(Path path) throws IOException {
    Files.walkFileTree(
        path,
        new SimpleFileVisitor<>() {
          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            // git marks pack files read-only
            file.toFile().setWritable(true);
            Files.deleteIfExists(file);
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            Files.deleteIfExists(dir);
            return FileVisitResult.CONTINUE;
          }
        });
  }
}
