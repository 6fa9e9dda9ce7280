package com.leakmonitor.backend.scan.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "discovered_repos")
public class DiscoveredRepo {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "full_name", nullable = false, unique = true, length = 255)
  private String fullName;

  @Column(name = "html_url", length = 512)
  private String htmlUrl;

  @Column(name = "description", columnDefinition = "text")
  private String description;

  @Column(name = "owner_login", length = 255)
  private String ownerLogin;

  @Column(name = "owner_type", length = 32)
  private String ownerType;

  @Column(name = "repo_size_kb")
  private Long repoSizeKb;

  @Column(name = "default_branch", length = 255)
  private String defaultBranch;

  @Column(name = "language", length = 64)
  private String language;

  @Column(name = "fork", nullable = false)
  private boolean fork;

  @Column(name = "stargazers_count")
  private Integer stargazersCount;

  @Column(name = "first_seen", nullable = false)
  private Instant firstSeen;

  @Column(name = "last_seen", nullable = false)
  private Instant lastSeen;

  @Column(name = "last_scanned")
  private Instant lastScanned;

  /** Push timestamp exactly as reported by GitHub (ISO-8601). */
  @Column(name = "github_pushed_at", length = 64)
  private String githubPushedAt;

  @Column(name = "scan_duration_seconds")
  private Double scanDurationSeconds;

  @Enumerated(EnumType.STRING)
  @Column(name = "scan_status", nullable = false, length = 32)
  private RepoScanStatus scanStatus = RepoScanStatus.PENDING;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "matched_keywords", nullable = false, columnDefinition = "jsonb")
  private List<String> matchedKeywords = new ArrayList<>();

  @Column(name = "ai_relevance")
  private Double aiRelevance;

  @Column(name = "ai_summary", columnDefinition = "text")
  private String aiSummary;

  @Column(name = "dismissed", nullable = false)
  private boolean dismissed;

  @Enumerated(EnumType.STRING)
  @Column(name = "scan_override", nullable = false, length = 32)
  private ScanOverride scanOverride = ScanOverride.AUTO;

  protected DiscoveredRepo() {}

  public DiscoveredRepo(String fullName) {
    this.fullName = fullName;
  }

  @PrePersist
  void onPersist() {
    Instant now = Instant.now();
    if (firstSeen == null) {
      firstSeen = now;
    }
    if (lastSeen == null) {
      lastSeen = now;
    }
  }

  /** Adds keywords not yet present, keeping the existing order. */
  public void mergeMatchedKeywords(Collection<String> keywords) {
    Set<String> merged = new LinkedHashSet<>(matchedKeywords == null ? List.of() : matchedKeywords);
    merged.addAll(keywords);
    this.matchedKeywords = new ArrayList<>(merged);
  }

  public boolean isPending() {
    return scanStatus == RepoScanStatus.PENDING;
  }

  public Long getId() {
    return id;
  }

  public String getFullName() {
    return fullName;
  }

  public String getHtmlUrl() {
    return htmlUrl;
  }

  public void setHtmlUrl(String htmlUrl) {
    this.htmlUrl = htmlUrl;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getOwnerLogin() {
    return ownerLogin;
  }

  public void setOwnerLogin(String ownerLogin) {
    this.ownerLogin = ownerLogin;
  }

  public String getOwnerType() {
    return ownerType;
  }

  public void setOwnerType(String ownerType) {
    this.ownerType = ownerType;
  }

  public Long getRepoSizeKb() {
    return repoSizeKb;
  }

  public void setRepoSizeKb(Long repoSizeKb) {
    this.repoSizeKb = repoSizeKb;
  }

  public String getDefaultBranch() {
    return defaultBranch;
  }

  public void setDefaultBranch(String defaultBranch) {
    this.defaultBranch = defaultBranch;
  }

  public String getLanguage() {
    return language;
  }

  public void setLanguage(String language) {
    this.language = language;
  }

  public boolean isFork() {
    return fork;
  }

  public void setFork(boolean fork) {
    this.fork = fork;
  }

  public Integer getStargazersCount() {
    return stargazersCount;
  }

  public void setStargazersCount(Integer stargazersCount) {
    this.stargazersCount = stargazersCount;
  }

  public Instant getFirstSeen() {
    return firstSeen;
  }

  public Instant getLastSeen() {
    return lastSeen;
  }

  public void setLastSeen(Instant lastSeen) {
    this.lastSeen = lastSeen;
  }

  public Instant getLastScanned() {
    return lastScanned;
  }

  public void setLastScanned(Instant lastScanned) {
    this.lastScanned = lastScanned;
  }

  public String getGithubPushedAt() {
    return githubPushedAt;
  }

  public void setGithubPushedAt(String githubPushedAt) {
    this.githubPushedAt = githubPushedAt;
  }

  public Double getScanDurationSeconds() {
    return scanDurationSeconds;
  }

  public void setScanDurationSeconds(Double scanDurationSeconds) {
    this.scanDurationSeconds = scanDurationSeconds;
  }

  public RepoScanStatus getScanStatus() {
    return scanStatus;
  }

  public void setScanStatus(RepoScanStatus scanStatus) {
    this.scanStatus = scanStatus;
  }

  public List<String> getMatchedKeywords() {
    return matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
  }

  public Double getAiRelevance() {
    return aiRelevance;
  }

  public void setAiRelevance(Double aiRelevance) {
    this.aiRelevance = aiRelevance;
  }

  public String getAiSummary() {
    return aiSummary;
  }

  public void setAiSummary(String aiSummary) {
    this.aiSummary = aiSummary;
  }

  public boolean isDismissed() {
    return dismissed;
  }

  public void setDismissed(boolean dismissed) {
    this.dismissed = dismissed;
  }

  public ScanOverride getScanOverride() {
    return scanOverride;
  }

  public void setScanOverride(ScanOverride scanOverride) {
    this.scanOverride = scanOverride == null ? ScanOverride.AUTO : scanOverride;
  }
}
