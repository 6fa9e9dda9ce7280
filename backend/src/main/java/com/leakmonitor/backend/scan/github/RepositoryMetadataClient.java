package com.leakmonitor.backend.scan.github;

import java.util.Optional;

public interface RepositoryMetadataClient {

  /** Repository details, empty when GitHub does not know the repository or the call failed. */
  Optional<RepoDetails> fetchDetails(String fullName);

  /** README text truncated to {@code maxChars}; empty string when unavailable. */
  String fetchReadme(String fullName, int maxChars);
}
