package com.leakmonitor.backend.scan.github;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.kohsuke.github.GHFileNotFoundException;
import org.kohsuke.github.GHRepository;
import org.kohsuke.github.GitHub;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
class GitHubRepositoryMetadataClient implements RepositoryMetadataClient {

  private static final Logger log = LoggerFactory.getLogger(GitHubRepositoryMetadataClient.class);

  private final GitHubClientFactory clientFactory;

  GitHubRepositoryMetadataClient(GitHubClientFactory clientFactory) {
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  @Override
  public Optional<RepoDetails> fetchDetails(String fullName) {
    try {
      return Optional.of(execute(github -> toDetails(loadRepository(github, fullName))));
    } catch (GitHubClientException ex) {
      log.warn("Failed to fetch details for {}: {}", fullName, rootMessage(ex));
      return Optional.empty();
    }
  }

  @Override
  public String fetchReadme(String fullName, int maxChars) {
    try {
      String readme = execute(github -> readReadme(loadRepository(github, fullName)));
      return readme.length() > maxChars ? readme.substring(0, maxChars) : readme;
    } catch (GitHubClientException ex) {
      log.debug("README unavailable for {}: {}", fullName, rootMessage(ex));
      return "";
    }
  }

  private <T> T execute(Function<GitHub, T> operation) {
    try {
      return operation.apply(clientFactory.createClient());
    } catch (IOException ex) {
      throw new GitHubClientException("Failed to execute GitHub API call", ex);
    }
  }

  private GHRepository loadRepository(GitHub github, String fullName) {
    try {
      return github.getRepository(fullName);
    } catch (IOException ex) {
      throw new GitHubClientException("Failed to load repository " + fullName, ex);
    }
  }

  private RepoDetails toDetails(GHRepository repository) {
    return new RepoDetails(
        repository.getFullName(),
        repository.getHtmlUrl() == null ? null : repository.getHtmlUrl().toString(),
        repository.getDescription(),
        repository.getOwnerName(),
        repository.getSize(),
        repository.getDefaultBranch(),
        repository.getLanguage(),
        repository.getStargazersCount(),
        repository.isFork(),
        repository.getPushedAt() == null ? null : repository.getPushedAt().toInstant().toString());
  }

  private String readReadme(GHRepository repository) {
    try (InputStream stream = repository.getReadme().read()) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (GHFileNotFoundException ex) {
      return "";
    } catch (IOException ex) {
      throw new GitHubClientException("Failed to read README of " + repository.getFullName(), ex);
    }
  }

  private static String rootMessage(Throwable ex) {
    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
    return cause.getMessage();
  }
}
