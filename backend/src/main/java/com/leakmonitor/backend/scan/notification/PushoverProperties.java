package com.leakmonitor.backend.scan.notification;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.notifications.pushover")
public class PushoverProperties {

  private String apiUrl = "https://api.pushover.net";
  private String token;
  private String userKey;
  private boolean onlyWithNewFindings = true;

  public String getApiUrl() {
    return apiUrl;
  }

  public void setApiUrl(String apiUrl) {
    this.apiUrl = apiUrl;
  }

  public String getToken() {
    return token;
  }

  public void setToken(String token) {
    this.token = token;
  }

  public String getUserKey() {
    return userKey;
  }

  public void setUserKey(String userKey) {
    this.userKey = userKey;
  }

  public boolean isOnlyWithNewFindings() {
    return onlyWithNewFindings;
  }

  public void setOnlyWithNewFindings(boolean onlyWithNewFindings) {
    this.onlyWithNewFindings = onlyWithNewFindings;
  }

  public boolean isConfigured() {
    return token != null && !token.isBlank() && userKey != null && !userKey.isBlank();
  }
}
