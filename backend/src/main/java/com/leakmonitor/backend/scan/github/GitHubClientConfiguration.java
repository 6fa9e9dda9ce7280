package com.leakmonitor.backend.scan.github;

import com.leakmonitor.backend.scan.config.GitHubProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class GitHubClientConfiguration {

  @Bean
  public WebClient gitHubWebClient(GitHubProperties properties) {
    WebClient.Builder builder =
        WebClient.builder()
            .baseUrl(properties.getApiBaseUrl())
            .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
            .defaultHeader("X-GitHub-Api-Version", "2022-11-28")
            .clientConnector(
                new ReactorClientHttpConnector(
                    HttpClient.create().responseTimeout(properties.getRequestTimeout())))
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(8 * 1024 * 1024));

    if (properties.getToken() != null && !properties.getToken().isBlank()) {
      builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getToken().trim());
    }

    return builder.build();
  }

  @Bean
  public GitHubRateLimiter gitHubRateLimiter(GitHubProperties properties) {
    return new GitHubRateLimiter(properties.getSearchRequestsPerMinute());
  }
}
