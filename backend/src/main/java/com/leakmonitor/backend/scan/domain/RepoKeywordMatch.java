package com.leakmonitor.backend.scan.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(
    name = "repo_keyword_matches",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_repo_keyword_match",
            columnNames = {"repo_id", "keyword", "match_source"}))
public class RepoKeywordMatch {

  public static final String SOURCE_CODE_SEARCH = "code_search";
  public static final int MAX_MATCH_FILES = 10;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "repo_id", nullable = false)
  private DiscoveredRepo repo;

  @Column(name = "keyword", nullable = false, length = 255)
  private String keyword;

  @Column(name = "match_source", nullable = false, length = 64)
  private String matchSource;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "match_files", nullable = false, columnDefinition = "jsonb")
  private List<String> matchFiles = new ArrayList<>();

  @Column(name = "match_context", columnDefinition = "text")
  private String matchContext;

  @Column(name = "active", nullable = false)
  private boolean active = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected RepoKeywordMatch() {}

  public RepoKeywordMatch(DiscoveredRepo repo, String keyword, String matchSource) {
    this.repo = repo;
    this.keyword = keyword;
    this.matchSource = matchSource;
  }

  @PrePersist
  void onPersist() {
    createdAt = Instant.now();
  }

  /** Unions the given files into the existing list, keeping at most {@link #MAX_MATCH_FILES}. */
  public void mergeMatchFiles(Collection<String> files) {
    Set<String> merged = new LinkedHashSet<>(matchFiles == null ? List.of() : matchFiles);
    merged.addAll(files);
    this.matchFiles = new ArrayList<>(merged.stream().limit(MAX_MATCH_FILES).toList());
  }

  public Long getId() {
    return id;
  }

  public DiscoveredRepo getRepo() {
    return repo;
  }

  public String getKeyword() {
    return keyword;
  }

  public String getMatchSource() {
    return matchSource;
  }

  public List<String> getMatchFiles() {
    return matchFiles == null ? List.of() : List.copyOf(matchFiles);
  }

  public String getMatchContext() {
    return matchContext;
  }

  public void setMatchContext(String matchContext) {
    this.matchContext = matchContext;
  }

  public boolean isActive() {
    return active;
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
