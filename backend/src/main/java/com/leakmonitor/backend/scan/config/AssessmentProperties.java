package com.leakmonitor.backend.scan.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.assessment")
public class AssessmentProperties {

  private boolean enabled = true;
  private double relevanceTemperature = 0.1;
  private double findingTemperature = 0.2;

  @Min(100)
  private int maxFindingChars = 3000;

  @Min(100)
  private int maxSummaryChars = 500;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public double getRelevanceTemperature() {
    return relevanceTemperature;
  }

  public void setRelevanceTemperature(double relevanceTemperature) {
    this.relevanceTemperature = relevanceTemperature;
  }

  public double getFindingTemperature() {
    return findingTemperature;
  }

  public void setFindingTemperature(double findingTemperature) {
    this.findingTemperature = findingTemperature;
  }

  public int getMaxFindingChars() {
    return maxFindingChars;
  }

  public void setMaxFindingChars(int maxFindingChars) {
    this.maxFindingChars = maxFindingChars;
  }

  public int getMaxSummaryChars() {
    return maxSummaryChars;
  }

  public void setMaxSummaryChars(int maxSummaryChars) {
    this.maxSummaryChars = maxSummaryChars;
  }
}
