package com.leakmonitor.backend.scan.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakmonitor.backend.scan.config.GitHubProperties;
import com.leakmonitor.backend.scan.github.CodeSearchException.Reason;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
class GitHubCodeSearchClient implements CodeSearchClient {

  private final WebClient gitHubWebClient;
  private final GitHubProperties properties;
  private final ObjectMapper objectMapper;

  GitHubCodeSearchClient(
      @Qualifier("gitHubWebClient") WebClient gitHubWebClient,
      GitHubProperties properties,
      ObjectMapper objectMapper) {
    this.gitHubWebClient = Objects.requireNonNull(gitHubWebClient, "gitHubWebClient");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public CodeSearchPage searchQuery(String query, int page) {
    RawResponse response;
    try {
      response =
          gitHubWebClient
              .get()
              .uri(
                  uri ->
                      uri.path("/search/code")
                          .queryParam("q", "{q}")
                          .queryParam("per_page", properties.getSearchPerPage())
                          .queryParam("page", page)
                          .build(Map.of("q", query)))
              .exchangeToMono(
                  clientResponse ->
                      clientResponse
                          .bodyToMono(String.class)
                          .defaultIfEmpty("")
                          .map(
                              body ->
                                  new RawResponse(
                                      clientResponse.statusCode().value(),
                                      clientResponse.headers().asHttpHeaders(),
                                      body)))
              .block(properties.getRequestTimeout());
    } catch (RuntimeException ex) {
      throw new CodeSearchException(
          Reason.TRANSIENT, "Code search request failed: " + ex.getMessage(), ex);
    }
    if (response == null) {
      throw new CodeSearchException(Reason.TRANSIENT, "Empty code search response", null, null);
    }
    Integer remaining = headerInt(response.headers(), "X-RateLimit-Remaining");
    Long reset = headerLong(response.headers(), "X-RateLimit-Reset");

    int status = response.status();
    if (status == 422) {
      throw new CodeSearchException(
          Reason.VALIDATION, "GitHub rejected query " + query, remaining, reset);
    }
    if (status == 403 || status == 429) {
      throw new CodeSearchException(
          Reason.EXHAUSTED, "GitHub search quota exhausted (HTTP " + status + ")", remaining, reset);
    }
    if (status < 200 || status >= 300) {
      throw new CodeSearchException(
          Reason.TRANSIENT, "GitHub search failed with HTTP " + status, remaining, reset);
    }
    return parse(response.body(), remaining, reset);
  }

  private CodeSearchPage parse(String body, Integer remaining, Long reset) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (Exception ex) {
      throw new CodeSearchException(Reason.TRANSIENT, "Unreadable code search payload", ex);
    }
    List<CodeSearchHit> hits = new ArrayList<>();
    for (JsonNode item : root.path("items")) {
      JsonNode repo = item.path("repository");
      String fullName = repo.path("full_name").asText("");
      if (fullName.isEmpty()) {
        continue;
      }
      JsonNode owner = repo.path("owner");
      hits.add(
          new CodeSearchHit(
              fullName,
              repo.path("html_url").asText(null),
              repo.path("description").isNull() ? null : repo.path("description").asText(null),
              owner.path("login").asText(null),
              owner.path("type").asText(null),
              repo.path("fork").asBoolean(false),
              item.path("path").asText("")));
    }
    return new CodeSearchPage(hits, root.path("total_count").asInt(0), remaining, reset);
  }

  private static Integer headerInt(HttpHeaders headers, String name) {
    String value = headers.getFirst(name);
    if (value == null) {
      return null;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private static Long headerLong(HttpHeaders headers, String name) {
    String value = headers.getFirst(name);
    if (value == null) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  private record RawResponse(int status, HttpHeaders headers, String body) {}
}
