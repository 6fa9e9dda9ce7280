package com.leakmonitor.backend.scan.github;

import com.leakmonitor.backend.scan.config.GitHubProperties;
import java.io.IOException;
import java.util.Objects;
import org.kohsuke.github.AbuseLimitHandler;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.kohsuke.github.RateLimitHandler;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
class GitHubClientFactory {

  private final GitHubProperties properties;

  GitHubClientFactory(GitHubProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  /** Token-authenticated client when a token is configured, anonymous otherwise. */
  GitHub createClient() throws IOException {
    GitHubBuilder builder = configure(new GitHubBuilder());
    if (StringUtils.hasText(properties.getToken())) {
      builder.withOAuthToken(properties.getToken().trim());
    }
    return builder.build();
  }

  private GitHubBuilder configure(GitHubBuilder builder) {
    // Quota pacing is owned by GitHubRateLimiter; fail fast instead of blocking inside the client.
    builder.withRateLimitHandler(RateLimitHandler.FAIL);
    builder.withAbuseLimitHandler(AbuseLimitHandler.WAIT);
    if (StringUtils.hasText(properties.getApiBaseUrl())) {
      builder.withEndpoint(properties.getApiBaseUrl().trim());
    }
    return builder;
  }
}
