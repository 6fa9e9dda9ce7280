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
import java.time.Duration;
import java.time.Instant;

@Entity
@Table(name = "scans")
public class Scan {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "started_at", nullable = false)
  private Instant startedAt;

  @Column(name = "finished_at")
  private Instant finishedAt;

  @Column(name = "resumed_at")
  private Instant resumedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 32)
  private ScanStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "trigger_kind", nullable = false, length = 32)
  private ScanTrigger trigger;

  @Column(name = "keywords_used", nullable = false)
  private int keywordsUsed;

  @Column(name = "repos_found", nullable = false)
  private int reposFound;

  @Column(name = "repos_scanned", nullable = false)
  private int reposScanned;

  @Column(name = "new_findings", nullable = false)
  private int newFindings;

  @Column(name = "total_findings", nullable = false)
  private int totalFindings;

  @Column(name = "error_message", columnDefinition = "text")
  private String errorMessage;

  @Column(name = "duration_seconds")
  private Double durationSeconds;

  protected Scan() {}

  public Scan(ScanTrigger trigger) {
    this.trigger = trigger;
    this.status = ScanStatus.RUNNING;
  }

  @PrePersist
  void onPersist() {
    if (startedAt == null) {
      startedAt = Instant.now();
    }
  }

  /**
   * Moves the scan to a terminal status, stamping finish time and a non-negative duration. The
   * duration of a resumed scan counts from its last resumption.
   */
  public void finish(ScanStatus terminalStatus, Instant now) {
    this.status = terminalStatus;
    this.finishedAt = now;
    Instant timingBase = resumedAt != null ? resumedAt : startedAt;
    if (timingBase != null) {
      long millis = Math.max(0L, Duration.between(timingBase, now).toMillis());
      this.durationSeconds = millis / 1000.0;
    } else {
      this.durationSeconds = 0.0;
    }
  }

  public void reopen(Instant now) {
    this.status = ScanStatus.RUNNING;
    this.errorMessage = null;
    this.finishedAt = null;
    this.resumedAt = now;
  }

  public Long getId() {
    return id;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public void setStartedAt(Instant startedAt) {
    this.startedAt = startedAt;
  }

  public Instant getResumedAt() {
    return resumedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public ScanStatus getStatus() {
    return status;
  }

  public void setStatus(ScanStatus status) {
    this.status = status;
  }

  public ScanTrigger getTrigger() {
    return trigger;
  }

  public int getKeywordsUsed() {
    return keywordsUsed;
  }

  public void setKeywordsUsed(int keywordsUsed) {
    this.keywordsUsed = keywordsUsed;
  }

  public int getReposFound() {
    return reposFound;
  }

  public void setReposFound(int reposFound) {
    this.reposFound = reposFound;
  }

  public int getReposScanned() {
    return reposScanned;
  }

  public void setReposScanned(int reposScanned) {
    this.reposScanned = reposScanned;
  }

  public int getNewFindings() {
    return newFindings;
  }

  public void setNewFindings(int newFindings) {
    this.newFindings = newFindings;
  }

  public int getTotalFindings() {
    return totalFindings;
  }

  public void setTotalFindings(int totalFindings) {
    this.totalFindings = totalFindings;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public Double getDurationSeconds() {
    return durationSeconds;
  }

  public boolean isRunning() {
    return status == ScanStatus.RUNNING;
  }
}
