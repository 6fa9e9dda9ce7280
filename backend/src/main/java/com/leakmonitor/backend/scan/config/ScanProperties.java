package com.leakmonitor.backend.scan.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.scan")
public class ScanProperties {

  @Min(1)
  private int maxRepoSizeMb = 500;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double relevanceThreshold = 0.30;

  private Duration cloneTimeout = Duration.ofSeconds(120);
  private Duration trufflehogTimeout = Duration.ofSeconds(300);
  private Duration gitleaksTimeout = Duration.ofSeconds(300);

  @Min(1)
  private long customMaxFileSizeBytes = 1_000_000L;

  private String workspaceRoot;
  private String gitBinary = "git";
  private String trufflehogBinary = "trufflehog";
  private String gitleaksBinary = "gitleaks";

  private final Schedule schedule = new Schedule();

  public int getMaxRepoSizeMb() {
    return maxRepoSizeMb;
  }

  public void setMaxRepoSizeMb(int maxRepoSizeMb) {
    this.maxRepoSizeMb = maxRepoSizeMb;
  }

  public long maxRepoSizeKb() {
    return (long) maxRepoSizeMb * 1024L;
  }

  public double getRelevanceThreshold() {
    return relevanceThreshold;
  }

  public void setRelevanceThreshold(double relevanceThreshold) {
    this.relevanceThreshold = relevanceThreshold;
  }

  public Duration getCloneTimeout() {
    return cloneTimeout;
  }

  public void setCloneTimeout(Duration cloneTimeout) {
    if (isPositive(cloneTimeout)) {
      this.cloneTimeout = cloneTimeout;
    }
  }

  public Duration getTrufflehogTimeout() {
    return trufflehogTimeout;
  }

  public void setTrufflehogTimeout(Duration trufflehogTimeout) {
    if (isPositive(trufflehogTimeout)) {
      this.trufflehogTimeout = trufflehogTimeout;
    }
  }

  public Duration getGitleaksTimeout() {
    return gitleaksTimeout;
  }

  public void setGitleaksTimeout(Duration gitleaksTimeout) {
    if (isPositive(gitleaksTimeout)) {
      this.gitleaksTimeout = gitleaksTimeout;
    }
  }

  public long getCustomMaxFileSizeBytes() {
    return customMaxFileSizeBytes;
  }

  public void setCustomMaxFileSizeBytes(long customMaxFileSizeBytes) {
    this.customMaxFileSizeBytes = customMaxFileSizeBytes;
  }

  public String getWorkspaceRoot() {
    return workspaceRoot;
  }

  public void setWorkspaceRoot(String workspaceRoot) {
    this.workspaceRoot = workspaceRoot;
  }

  public Path workspaceRootPath() {
    if (StringUtils.hasText(workspaceRoot)) {
      return Path.of(workspaceRoot.trim()).toAbsolutePath().normalize();
    }
    return Path.of(System.getProperty("java.io.tmpdir"), "leak-monitor").toAbsolutePath();
  }

  public String getGitBinary() {
    return gitBinary;
  }

  public void setGitBinary(String gitBinary) {
    if (StringUtils.hasText(gitBinary)) {
      this.gitBinary = gitBinary.trim();
    }
  }

  public String getTrufflehogBinary() {
    return trufflehogBinary;
  }

  public void setTrufflehogBinary(String trufflehogBinary) {
    if (StringUtils.hasText(trufflehogBinary)) {
      this.trufflehogBinary = trufflehogBinary.trim();
    }
  }

  public String getGitleaksBinary() {
    return gitleaksBinary;
  }

  public void setGitleaksBinary(String gitleaksBinary) {
    if (StringUtils.hasText(gitleaksBinary)) {
      this.gitleaksBinary = gitleaksBinary.trim();
    }
  }

  public Schedule getSchedule() {
    return schedule;
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }

  public static class Schedule {

    private boolean enabled = true;
    private String cron = "0 0 1 * * *";
    private String zone = "UTC";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }

    public String getZone() {
      return zone;
    }

    public void setZone(String zone) {
      this.zone = zone;
    }
  }
}
