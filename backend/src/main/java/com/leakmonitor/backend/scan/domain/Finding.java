package com.leakmonitor.backend.scan.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "findings")
public class Finding {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "finding_hash", nullable = false, unique = true, length = 64)
  private String findingHash;

  @ManyToOne(fetch = FetchType.LAZY, optional = false)
  @JoinColumn(name = "repo_id", nullable = false)
  private DiscoveredRepo repo;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "scan_id")
  private Scan scan;

  @Column(name = "scanner", nullable = false, length = 32)
  private String scanner;

  @Column(name = "detector_name", length = 255)
  private String detectorName;

  @Column(name = "verified", nullable = false)
  private boolean verified;

  @Column(name = "file_path", columnDefinition = "text")
  private String filePath;

  @Column(name = "commit_hash", length = 64)
  private String commitHash;

  @Column(name = "line_number")
  private Integer lineNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "severity", nullable = false, length = 16)
  private FindingSeverity severity;

  @Column(name = "ai_assessment", columnDefinition = "text")
  private String aiAssessment;

  @Column(name = "matched_snippet", columnDefinition = "text")
  private String matchedSnippet;

  @Column(name = "first_seen", nullable = false)
  private Instant firstSeen;

  @Column(name = "last_seen", nullable = false)
  private Instant lastSeen;

  @Column(name = "resolved", nullable = false)
  private boolean resolved;

  @Column(name = "resolved_at")
  private Instant resolvedAt;

  @Column(name = "notes", columnDefinition = "text")
  private String notes;

  protected Finding() {}

  public Finding(String findingHash, DiscoveredRepo repo, Scan scan) {
    this.findingHash = findingHash;
    this.repo = repo;
    this.scan = scan;
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

  public void resolve(String note, Instant now) {
    this.resolved = true;
    this.resolvedAt = now;
    this.notes = notes == null || notes.isBlank() ? note : notes + "\n" + note;
  }

  public Long getId() {
    return id;
  }

  public String getFindingHash() {
    return findingHash;
  }

  public DiscoveredRepo getRepo() {
    return repo;
  }

  public Scan getScan() {
    return scan;
  }

  public String getScanner() {
    return scanner;
  }

  public void setScanner(String scanner) {
    this.scanner = scanner;
  }

  public String getDetectorName() {
    return detectorName;
  }

  public void setDetectorName(String detectorName) {
    this.detectorName = detectorName;
  }

  public boolean isVerified() {
    return verified;
  }

  public void setVerified(boolean verified) {
    this.verified = verified;
  }

  public String getFilePath() {
    return filePath;
  }

  public void setFilePath(String filePath) {
    this.filePath = filePath;
  }

  public String getCommitHash() {
    return commitHash;
  }

  public void setCommitHash(String commitHash) {
    this.commitHash = commitHash;
  }

  public Integer getLineNumber() {
    return lineNumber;
  }

  public void setLineNumber(Integer lineNumber) {
    this.lineNumber = lineNumber;
  }

  public FindingSeverity getSeverity() {
    return severity;
  }

  public void setSeverity(FindingSeverity severity) {
    this.severity = severity;
  }

  public String getAiAssessment() {
    return aiAssessment;
  }

  public void setAiAssessment(String aiAssessment) {
    this.aiAssessment = aiAssessment;
  }

  public String getMatchedSnippet() {
    return matchedSnippet;
  }

  public void setMatchedSnippet(String matchedSnippet) {
    this.matchedSnippet = matchedSnippet;
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

  public boolean isResolved() {
    return resolved;
  }

  public Instant getResolvedAt() {
    return resolvedAt;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }
}
