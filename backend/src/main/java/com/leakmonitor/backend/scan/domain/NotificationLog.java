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
import java.time.Instant;

@Entity
@Table(name = "notification_logs")
public class NotificationLog {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "scan_id")
  private Scan scan;

  @Column(name = "channel", nullable = false, length = 32)
  private String channel;

  @Column(name = "success", nullable = false)
  private boolean success;

  @Column(name = "message", columnDefinition = "text")
  private String message;

  @Column(name = "sent_at", nullable = false)
  private Instant sentAt;

  protected NotificationLog() {}

  public NotificationLog(Scan scan, String channel, boolean success, String message) {
    this.scan = scan;
    this.channel = channel;
    this.success = success;
    this.message = message;
  }

  @PrePersist
  void onPersist() {
    sentAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Scan getScan() {
    return scan;
  }

  public String getChannel() {
    return channel;
  }

  public boolean isSuccess() {
    return success;
  }

  public String getMessage() {
    return message;
  }

  public Instant getSentAt() {
    return sentAt;
  }
}
