package com.leakmonitor.backend.scan.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.github")
public class GitHubProperties {

  @NotBlank
  private String apiBaseUrl = "https://api.github.com";

  private String token;

  @Min(1)
  private int searchRequestsPerMinute = 10;

  @Min(1)
  @Max(100)
  private int searchPerPage = 100;

  @Min(1)
  private int searchMaxPages = 10;

  @Min(1)
  private int maxMatchFilesPerKeyword = 10;

  @Min(1)
  private int readmeMaxChars = 2000;

  private Duration searchAcquireTimeout = Duration.ofSeconds(120);
  private Duration detailsAcquireTimeout = Duration.ofSeconds(60);
  private Duration readmeAcquireTimeout = Duration.ofSeconds(30);
  private Duration requestTimeout = Duration.ofSeconds(30);

  public String getApiBaseUrl() {
    return apiBaseUrl;
  }

  public void setApiBaseUrl(String apiBaseUrl) {
    this.apiBaseUrl = apiBaseUrl;
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  public int getSearchRequestsPerMinute() {
    return searchRequestsPerMinute;
  }

  public void setSearchRequestsPerMinute(int searchRequestsPerMinute) {
    this.searchRequestsPerMinute = Math.max(1, searchRequestsPerMinute);
  }

  public int getSearchPerPage() {
    return searchPerPage;
  }

  public void setSearchPerPage(int searchPerPage) {
    this.searchPerPage = searchPerPage;
  }

  public int getSearchMaxPages() {
    return searchMaxPages;
  }

  public void setSearchMaxPages(int searchMaxPages) {
    this.searchMaxPages = searchMaxPages;
  }

  public int getMaxMatchFilesPerKeyword() {
    return maxMatchFilesPerKeyword;
  }

  public void setMaxMatchFilesPerKeyword(int maxMatchFilesPerKeyword) {
    this.maxMatchFilesPerKeyword = maxMatchFilesPerKeyword;
  }

  public int getReadmeMaxChars() {
    return readmeMaxChars;
  }

  public void setReadmeMaxChars(int readmeMaxChars) {
    this.readmeMaxChars = readmeMaxChars;
  }

  public Duration getSearchAcquireTimeout() {
    return searchAcquireTimeout;
  }

  public void setSearchAcquireTimeout(Duration searchAcquireTimeout) {
    this.searchAcquireTimeout = searchAcquireTimeout;
  }

  public Duration getDetailsAcquireTimeout() {
    return detailsAcquireTimeout;
  }

  public void setDetailsAcquireTimeout(Duration detailsAcquireTimeout) {
    this.detailsAcquireTimeout = detailsAcquireTimeout;
  }

  public Duration getReadmeAcquireTimeout() {
    return readmeAcquireTimeout;
  }

  public void setReadmeAcquireTimeout(Duration readmeAcquireTimeout) {
    this.readmeAcquireTimeout = readmeAcquireTimeout;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public void setRequestTimeout(Duration requestTimeout) {
    this.requestTimeout = requestTimeout;
  }
}
