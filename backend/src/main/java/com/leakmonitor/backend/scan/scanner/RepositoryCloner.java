package com.leakmonitor.backend.scan.scanner;

import com.leakmonitor.backend.scan.config.ScanProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RepositoryCloner {

  private static final Logger log = LoggerFactory.getLogger(RepositoryCloner.class);

  private final ProcessRunner processRunner;
  private final ScanProperties properties;

  public RepositoryCloner(ProcessRunner processRunner, ScanProperties properties) {
    this.processRunner = processRunner;
    this.properties = properties;
  }

  /**
   * Opens a fresh workspace and attempts a shallow clone into it. A failed clone still yields a
   * workspace; callers check {@link CloneWorkspace#isCloned()}.
   */
  public CloneWorkspace cloneShallow(String repoFullName, String remoteUrl) throws IOException {
    Path root = properties.workspaceRootPath();
    Files.createDirectories(root);
    String prefix = repoFullName.replaceAll("[^A-Za-z0-9._-]", "_") + "-";
    CloneWorkspace workspace = new CloneWorkspace(Files.createTempDirectory(root, prefix));
    List<String> command =
        List.of(
            properties.getGitBinary(),
            "clone",
            "--depth=1",
            "--single-branch",
            remoteUrl,
            workspace.checkoutPath().toString());
    try {
      ProcessResult result = processRunner.run(command, null, properties.getCloneTimeout());
      if (result.succeeded()) {
        workspace.markCloned();
      } else {
        log.warn("git clone of {} failed: {}", repoFullName, result.stderr().strip());
      }
    } catch (ProcessExecutionException ex) {
      log.warn("git clone of {} failed: {}", repoFullName, ex.getMessage());
    }
    return workspace;
  }
}
